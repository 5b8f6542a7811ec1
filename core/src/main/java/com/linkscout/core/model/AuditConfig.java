package com.linkscout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤/점검 설정 (linkscout.yml 매핑 대상). 순수 설정 보관용.
 * 크롤 모드는 target/maxDepth, 점검 모드는 {@link ScanCfg} 를 주로 사용한다.
 */
public final class AuditConfig {

    public static final String DEFAULT_TARGET = "https://hamzak.cloud";
    public static final List<String> DEFAULT_URL_ATTRIBUTES = List.of(
            "href", "src", "action", "data-href", "data-src", "data-url", "data-link", "oneclick");

    /** 점검(깨진 링크) 관련 하위 설정: YAML의 `scan:` 섹션과 매핑 */
    public static final class ScanCfg {
        /** 시드 URL 동시 처리 상한 (바깥 풀) */
        private int seedConcurrency = 10;
        /** 페이지당 링크 동시 확인 상한 (안쪽 풀) */
        private int linkConcurrency = 20;
        /** "깨짐"으로 볼 상태 코드 집합 */
        private Set<Integer> errorStatuses = Set.of(404);
        /** 상태 코드 없이 실패한 확인(전송 오류)도 기록할지. 기본 false */
        private boolean reportCheckFailures = false;

        public int getSeedConcurrency() { return seedConcurrency; }
        public ScanCfg setSeedConcurrency(int v) { this.seedConcurrency = v; return this; }

        public int getLinkConcurrency() { return linkConcurrency; }
        public ScanCfg setLinkConcurrency(int v) { this.linkConcurrency = v; return this; }

        public Set<Integer> getErrorStatuses() { return errorStatuses; }
        public ScanCfg setErrorStatuses(Set<Integer> codes) {
            if (codes != null && !codes.isEmpty()) this.errorStatuses = Set.copyOf(codes);
            return this;
        }

        public boolean isReportCheckFailures() { return reportCheckFailures; }
        public ScanCfg setReportCheckFailures(boolean v) { this.reportCheckFailures = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String target = DEFAULT_TARGET;  // 크롤 시작 URL
    private int maxDepth = 1;                // 트리 최대 깊이
    private Duration timeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private String userAgent = "LinkScout/0.1 (+crawler)";
    private Path outputDir = Path.of("out");

    /** 링크 후보를 읽어올 속성 목록 (YAML `extractor.attributes`) */
    private List<String> urlAttributes = DEFAULT_URL_ATTRIBUTES;

    /** YAML `scan:` 섹션 매핑 */
    private ScanCfg scan = new ScanCfg();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }
    public List<String> getUrlAttributes() { return urlAttributes; }
    public ScanCfg getScan() { return scan; }

    /** 점검 설정 단축 접근자 */
    public Set<Integer> getErrorStatuses() { return scan.getErrorStatuses(); }

    // ---------- fluent setters ----------
    public AuditConfig setTarget(String target) { this.target = target; return this; }
    public AuditConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public AuditConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public AuditConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public AuditConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public AuditConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public AuditConfig setScan(ScanCfg scan) { this.scan = (scan != null ? scan : new ScanCfg()); return this; }

    public AuditConfig setUrlAttributes(List<String> attrs) {
        if (attrs != null && !attrs.isEmpty()) {
            // 순서 유지 + 중복 제거
            this.urlAttributes = List.copyOf(new LinkedHashSet<>(attrs));
        }
        return this;
    }

    public AuditConfig setErrorStatuses(Set<Integer> codes) {
        scan.setErrorStatuses(codes);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(urlAttributes, "urlAttributes");
        if (urlAttributes.isEmpty()) throw new IllegalArgumentException("urlAttributes must not be empty");

        Objects.requireNonNull(scan, "scan");
        if (scan.getSeedConcurrency() < 1)
            throw new IllegalArgumentException("scan.seedConcurrency must be >= 1");
        if (scan.getLinkConcurrency() < 1)
            throw new IllegalArgumentException("scan.linkConcurrency must be >= 1");
        Objects.requireNonNull(scan.getErrorStatuses(), "scan.errorStatuses");
        for (Integer code : scan.getErrorStatuses()) {
            if (code == null || code < 100 || code > 999)
                throw new IllegalArgumentException("scan.errorStatuses contains invalid code: " + code);
        }
    }

    // ---------- helpers ----------
    public static AuditConfig defaults() { return new AuditConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public AuditConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
