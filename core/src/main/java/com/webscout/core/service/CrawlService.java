package com.webscout.core.service;

import com.webscout.core.api.IFetcher;
import com.webscout.core.crawler.CrawlState;
import com.webscout.core.crawler.Crawler;
import com.webscout.core.crawler.FindingListener;
import com.webscout.core.http.HttpFetcher;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.model.CrawlReport;
import com.webscout.core.model.ProgressSnapshot;
import com.webscout.core.util.CrawlEvent;
import com.webscout.core.util.CrawlEventLog;
import com.webscout.core.util.DefaultSleeper;
import com.webscout.core.util.ProgressListener;
import com.webscout.core.util.Sleeper;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤 오케스트레이터:
 *  - 설정 검증 → Crawler 실행 → 정렬된 CrawlReport 생성
 *  - 기본 구현체(HttpFetcher/DefaultSleeper)
 *  - DI 생성자는 테스트용(가짜 fetcher, 지연 없는 sleeper)
 *
 * 서비스 하나당 run()은 한 번. 취소돼도 그때까지의 발견으로 보고서를 만든다.
 */
public final class CrawlService {

    private static final CrawlEventLog ELOG = CrawlEventLog.of(CrawlService.class);

    private final CrawlConfig config;
    private final Crawler crawler;

    /** 기본 구현 */
    public CrawlService(CrawlConfig config) {
        this(config, FindingListener.NONE);
    }

    /** 발견 즉시 알림을 받는 기본 구현(CLI 출력용) */
    public CrawlService(CrawlConfig config, FindingListener findingListener) {
        this(validated(config), null, new DefaultSleeper(), findingListener);
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, IFetcher fetcher, Sleeper sleeper, FindingListener findingListener) {
        this.config = validated(config);
        IFetcher f = (fetcher != null) ? fetcher : new HttpFetcher(this.config);
        this.crawler = new Crawler(this.config, f, sleeper, findingListener);
    }

    private static CrawlConfig validated(CrawlConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    public CrawlReport run() {
        return run(ProgressListener.NONE, null);
    }

    public CrawlReport run(ProgressListener listener) {
        return run(listener, null);
    }

    /** 진행률 + 취소 플래그(옵션) */
    public CrawlReport run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final String target = config.getTarget().trim();

        ELOG.event(CrawlEvent.CRAWL_START)
                .with("target", target)
                .with("maxDepth", depthLabel())
                .with("cc", config.getConcurrency())
                .with("delayMs", config.getDelay().toMillis())
                .log();

        long t0 = System.nanoTime();
        CrawlState state = crawler.crawl(pl, cancelFlag);
        long wallMs = (System.nanoTime() - t0) / 1_000_000L;

        CrawlReport report = state.toReport(target, config.getMaxDepth());
        ProgressSnapshot last = state.snapshot();

        ELOG.event(CrawlEvent.CRAWL_DONE)
                .with("crawled", last.crawled)
                .with("html", report.stats.totalHtml)
                .with("backend", report.stats.totalBackend)
                .with("functions", report.stats.totalFunctions)
                .with("cancelled", crawler.wasCancelled())
                .with("wallMs", wallMs)
                .log();
        return report;
    }

    /** 실행 중인 크롤에 중지 요청 */
    public void stop() {
        crawler.stop();
    }

    public boolean wasCancelled() {
        return crawler.wasCancelled();
    }

    public ProgressSnapshot getProgressSnapshot() {
        return crawler.getState().snapshot();
    }

    public CrawlConfig getConfig() {
        return config;
    }

    private String depthLabel() {
        return config.isUnlimitedDepth() ? "unlimited" : String.valueOf(config.getMaxDepth());
    }
}
