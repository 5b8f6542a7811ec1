package com.linkscout.core.util;

import org.slf4j.LoggerFactory;

/** 진행률 콜백. CLI 는 콘솔 한 줄, 테스트는 보통 NONE. */
@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "crawl" | "scan"
     * @param done     처리 수
     * @param total    전체 수(크롤처럼 모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};

    /** 리스너 예외가 크롤/점검을 멈추지 않도록 감싸서 호출 */
    static void emit(ProgressListener pl, String phase, long done, long total) {
        if (pl == null || pl == NONE) return;
        double p = (total > 0) ? Math.max(0.0, Math.min(1.0, (double) done / (double) total)) : 0.0;
        try {
            pl.onProgress(p, phase, done, total);
        } catch (RuntimeException e) {
            LoggerFactory.getLogger(ProgressListener.class).debug("progress listener failed: {}", e.toString());
        }
    }
}
