package com.linkscout.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 페이지 가져오기 결과: 성공(PageData) 또는 실패(사유).
 * 실패는 예외가 아니라 흔한 분기이므로 값으로 돌려준다.
 */
public final class FetchResult {
    private final String url;
    private final PageData page;    // 실패 시 null
    private final String reason;    // 성공 시 null

    private FetchResult(String url, PageData page, String reason) {
        this.url = Objects.requireNonNull(url, "url");
        this.page = page;
        this.reason = reason;
    }

    public static FetchResult ok(PageData page) {
        Objects.requireNonNull(page, "page");
        return new FetchResult(page.getUrl(), page, null);
    }

    public static FetchResult failed(String url, String reason) {
        return new FetchResult(url, null, (reason == null || reason.isBlank()) ? "unknown" : reason);
    }

    public boolean isOk() { return page != null; }
    public String getUrl() { return url; }
    public Optional<PageData> page() { return Optional.ofNullable(page); }
    public String getReason() { return reason; }

    @Override public String toString() {
        return isOk() ? "FetchResult[ok " + url + "]" : "FetchResult[failed " + url + ": " + reason + "]";
    }
}
