package com.webscout.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * CLI 옵션은 YAML 로드 후 위에 덮어쓴다.
 *
 * maxDepth 0 은 "무제한"으로 해석한다(도움말 표기와 일치).
 */
public final class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "WebScout/0.1 (+crawler)";

    // ---------- 기본 필드 ----------
    private String target;                 // 시작 URL (필수)
    private int maxDepth = 3;              // 0 = 무제한
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean followRedirects = true;
    private int concurrency = 1;           // 동시에 처리하는 프런티어 항목 수

    private Duration pageTimeout = Duration.ofSeconds(10);
    private Duration scriptTimeout = Duration.ofSeconds(5);
    private Duration delay = Duration.ofMillis(500);            // URL당 고정 지연
    private Duration progressInterval = Duration.ofMillis(100); // 진행 표시 폴링 주기

    /** CDN 등 외부 도메인 스크립트도 분석할지(엔드포인트는 어차피 도메인 필터링됨) */
    private boolean analyzeOffDomainScripts = true;

    private Path outputDir = Path.of(".");

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getConcurrency() { return concurrency; }
    public Duration getPageTimeout() { return pageTimeout; }
    public Duration getScriptTimeout() { return scriptTimeout; }
    public Duration getDelay() { return delay; }
    public Duration getProgressInterval() { return progressInterval; }
    public boolean isAnalyzeOffDomainScripts() { return analyzeOffDomainScripts; }
    public Path getOutputDir() { return outputDir; }

    /** 0(무제한)을 풀어 실제 비교에 쓰는 상한 */
    public int getEffectiveMaxDepth() {
        return maxDepth == 0 ? Integer.MAX_VALUE : maxDepth;
    }

    public boolean isUnlimitedDepth() { return maxDepth == 0; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent;
        return this;
    }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setPageTimeout(Duration d) { this.pageTimeout = d; return this; }
    public CrawlConfig setScriptTimeout(Duration d) { this.scriptTimeout = d; return this; }
    public CrawlConfig setDelay(Duration d) { this.delay = d; return this; }
    public CrawlConfig setProgressInterval(Duration d) { this.progressInterval = d; return this; }
    public CrawlConfig setAnalyzeOffDomainScripts(boolean v) { this.analyzeOffDomainScripts = v; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    /** 밀리초 편의 세터: 하한 1ms */
    public CrawlConfig setPageTimeoutMs(long ms) { this.pageTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public CrawlConfig setScriptTimeoutMs(long ms) { this.scriptTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public CrawlConfig setProgressIntervalMs(long ms) { this.progressInterval = Duration.ofMillis(Math.max(1, ms)); return this; }
    /** 지연은 0 허용(테스트용) */
    public CrawlConfig setDelayMs(long ms) { this.delay = Duration.ofMillis(Math.max(0, ms)); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        URI u;
        try {
            u = URI.create(target.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("target is not a valid URL: " + target, e);
        }
        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new IllegalArgumentException("target scheme must be http or https: " + target);
        if (u.getRawAuthority() == null || u.getRawAuthority().isBlank())
            throw new IllegalArgumentException("target must have a host: " + target);

        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        requirePositive(pageTimeout, "pageTimeout");
        requirePositive(scriptTimeout, "scriptTimeout");
        requirePositive(progressInterval, "progressInterval");
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    @Override public String toString() {
        return "CrawlConfig{target=" + target + ", maxDepth=" + maxDepth
                + ", concurrency=" + concurrency + ", pageTimeout=" + pageTimeout
                + ", scriptTimeout=" + scriptTimeout + ", delay=" + delay + "}";
    }
}
