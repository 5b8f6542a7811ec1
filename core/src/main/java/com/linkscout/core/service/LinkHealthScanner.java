package com.linkscout.core.service;

import com.linkscout.core.api.ILinkChecker;
import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.crawler.DefaultPageFetcher;
import com.linkscout.core.crawler.LinkPolicy;
import com.linkscout.core.http.HttpLinkChecker;
import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.model.BrokenLinkRecord;
import com.linkscout.core.model.FetchResult;
import com.linkscout.core.model.LinkCheckResult;
import com.linkscout.core.model.PageData;
import com.linkscout.core.model.ScanStats;
import com.linkscout.core.util.ProgressListener;
import com.linkscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 깨진 링크 점검 오케스트레이터:
 *  - 시드 URL 들을 바깥 고정 풀(기본 10)로 동시에 처리
 *  - 시드마다 페이지를 가져와 링크를 추출하고, 안쪽 고정 풀(기본 20)로 HEAD 확인
 *  - 오류 상태 코드(기본 {404})인 것만 BrokenLinkRecord 로 남긴다
 *
 * 각 작업은 결과를 Future 로 돌려주고, 결과 리스트는 수집하는 호출 스레드만 만진다.
 * 결과 순서는 완료 순서이므로 호출자는 순서 없는 다중집합으로 다뤄야 한다.
 */
public final class LinkHealthScanner {

    private static final Logger LOG = LoggerFactory.getLogger(LinkHealthScanner.class);
    private static final StructuredLog SLOG = StructuredLog.get(LinkHealthScanner.class);

    static final String BROKEN_MAIN_PAGE = "Broken main page";

    private final ScanStats stats = new ScanStats();
    private final AuditConfig config;
    private final IPageFetcher fetcher;
    private final ILinkChecker checker;
    private final Set<Integer> errorStatuses;

    /** 기본 구현 */
    public LinkHealthScanner(AuditConfig config) {
        this(config, new DefaultPageFetcher(config, LinkPolicy.ANY_VALID), new HttpLinkChecker(config));
    }

    /** DI/테스트용 */
    public LinkHealthScanner(AuditConfig config, IPageFetcher fetcher, ILinkChecker checker) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.checker = Objects.requireNonNull(checker, "checker");
        this.errorStatuses = Set.copyOf(config.getErrorStatuses());
    }

    /* =========================
       실행 API
       ========================= */

    public List<BrokenLinkRecord> scan(List<String> seeds) {
        return scan(seeds, ProgressListener.NONE);
    }

    public List<BrokenLinkRecord> scan(List<String> seeds, ProgressListener listener) {
        Objects.requireNonNull(seeds, "seeds");
        final int cc = config.getScan().getSeedConcurrency();
        final int total = seeds.size();

        LOG.info("Processing {} URLs concurrently (seedConcurrency={}, linkConcurrency={}, errorStatuses={})",
                total, cc, config.getScan().getLinkConcurrency(), errorStatuses);
        SLOG.info("scan-start", "seeds", total, "seedCc", cc,
                "linkCc", config.getScan().getLinkConcurrency(),
                "errorStatuses", String.valueOf(errorStatuses));

        if (total == 0) {
            SLOG.info("scan-done", "seeds", 0, "records", 0);
            return List.of();
        }

        ExecutorService exec = newFixedPool(cc, "scan-seed");
        CompletionService<List<BrokenLinkRecord>> completion = new ExecutorCompletionService<>(exec);
        final AtomicInteger inFlight = new AtomicInteger(0);

        for (String seed : seeds) {
            completion.submit(() -> {
                stats.observeSeedConcurrency(inFlight.incrementAndGet());
                try {
                    return processSeed(seed);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        }

        // 단일 수집자: 완료되는 순서대로 append
        List<BrokenLinkRecord> results = new ArrayList<>();
        int done = 0;
        try {
            for (int i = 0; i < total; i++) {
                try {
                    results.addAll(completion.take().get());
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Seed task failed: {}", cause.toString());
                    SLOG.error("seed-task-failed", cause, "cause", cause.toString());
                }
                ProgressListener.emit(listener, "scan", ++done, total);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while collecting results");
        } finally {
            shutdown(exec);
        }

        var snap = stats.snapshot();
        LOG.info("Scan done. seeds={}, skipped={}, linksChecked={}, records={}",
                total, snap.seedsSkipped(), snap.linksChecked(), results.size());
        SLOG.info("scan-done",
                "seeds", total,
                "skipped", snap.seedsSkipped(),
                "linksChecked", snap.linksChecked(),
                "checkFailures", snap.checkFailures(),
                "records", results.size());
        return results;
    }

    /**
     * 시드 한 개 처리(한 단계 깊이): 페이지를 가져와 자신과 모든 링크를 확인한다.
     * 페이지를 가져오지 못하면 기록 없이 빈 리스트.
     */
    public List<BrokenLinkRecord> processSeed(String url) {
        Objects.requireNonNull(url, "url");
        LOG.info("Processing: {}", url);
        List<BrokenLinkRecord> records = new ArrayList<>();

        FetchResult fetched = fetcher.fetch(url);
        if (!fetched.isOk()) {
            stats.seedSkipped();
            return records;
        }
        stats.seedScanned();
        PageData page = fetched.page().orElseThrow();

        // 1) 페이지 자신
        LinkCheckResult self = checker.check(url);
        stats.linkChecked(self);
        if (isBroken(self)) {
            String err = self.error().isEmpty() ? BROKEN_MAIN_PAGE : self.error();
            records.add(new BrokenLinkRecord(url, url, self.status(), err));
        }

        // 2) 페이지의 링크들
        List<String> links = new ArrayList<>(page.getLinks());
        LOG.info("Found {} links on {}. Checking concurrently...", links.size(), url);
        if (links.isEmpty()) return records;

        final int cc = config.getScan().getLinkConcurrency();
        ExecutorService exec = newFixedPool(cc, "scan-link");
        CompletionService<LinkCheckResult> completion = new ExecutorCompletionService<>(exec);
        final AtomicInteger inFlight = new AtomicInteger(0);

        for (String link : links) {
            completion.submit(() -> {
                stats.observeLinkConcurrency(inFlight.incrementAndGet());
                try {
                    return checker.check(link);
                } catch (RuntimeException e) {
                    return LinkCheckResult.unreachable(link, String.valueOf(e.getMessage()));
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        }

        try {
            for (int i = 0; i < links.size(); i++) {
                LinkCheckResult r;
                try {
                    r = completion.take().get();
                } catch (ExecutionException e) {
                    LOG.warn("Link check task failed on {}: {}", url, String.valueOf(e.getCause()));
                    continue;
                }
                stats.linkChecked(r);
                if (isBroken(r)) {
                    records.add(new BrokenLinkRecord(url, r.url(), r.status(), r.error()));
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while checking links of " + url);
        } finally {
            shutdown(exec);
        }

        SLOG.info("page-scanned", "url", url, "links", links.size(), "records", records.size());
        return records;
    }

    /** 오류 집합에 속한 상태 코드만 깨짐. 상태 없는 실패는 설정이 켜졌을 때만 */
    private boolean isBroken(LinkCheckResult r) {
        if (r.status() == null) return config.getScan().isReportCheckFailures();
        return errorStatuses.contains(r.status());
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    public ScanStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    private static ExecutorService newFixedPool(int cc, String prefix) {
        // 초과 작업은 큐에 쌓는다(무제한 생성 없음)
        return new ThreadPoolExecutor(cc, cc, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory(prefix));
    }

    private static void shutdown(ExecutorService exec) {
        exec.shutdownNow();
        try {
            exec.awaitTermination(30, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
