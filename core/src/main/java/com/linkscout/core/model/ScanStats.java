package com.linkscout.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 점검 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScanStats {
    private final AtomicLong seedsScanned   = new AtomicLong(0); // 페이지를 가져온 시드 수
    private final AtomicLong seedsSkipped   = new AtomicLong(0); // 가져오기 실패로 건너뛴 시드 수
    private final AtomicLong linksChecked   = new AtomicLong(0); // HEAD 확인 총합(시드 자신 포함)
    private final AtomicLong checkFailures  = new AtomicLong(0); // 상태 코드 없이 실패한 확인
    private final AtomicInteger maxSeedConcurrency = new AtomicInteger(0);
    private final AtomicInteger maxLinkConcurrency = new AtomicInteger(0);

    public void seedScanned() { seedsScanned.incrementAndGet(); }
    public void seedSkipped() { seedsSkipped.incrementAndGet(); }

    public void linkChecked(LinkCheckResult r) {
        linksChecked.incrementAndGet();
        if (r != null && !r.isDetermined()) checkFailures.incrementAndGet();
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeSeedConcurrency(int current) {
        maxSeedConcurrency.accumulateAndGet(current, Math::max);
    }
    public void observeLinkConcurrency(int current) {
        maxLinkConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(seedsScanned.get(), seedsSkipped.get(), linksChecked.get(),
                checkFailures.get(), maxSeedConcurrency.get(), maxLinkConcurrency.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(long seedsScanned, long seedsSkipped, long linksChecked, long checkFailures,
                           int maxSeedConcurrency, int maxLinkConcurrency) {}
}
