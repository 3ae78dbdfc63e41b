package com.webscout.core.crawler;

import com.webscout.core.api.IFetcher;
import com.webscout.core.crawler.script.ScriptAnalysis;
import com.webscout.core.crawler.script.ScriptAnalyzer;
import com.webscout.core.http.HttpFetcher;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.model.FetchResult;
import com.webscout.core.model.FrontierEntry;
import com.webscout.core.util.CrawlEvent;
import com.webscout.core.util.CrawlEventLog;
import com.webscout.core.util.DefaultSleeper;
import com.webscout.core.util.ProgressListener;
import com.webscout.core.util.Sleeper;
import com.webscout.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BFS 기반 Crawler (스케줄러)
 * - 시드 (target, 0) 하나로 시작, FIFO 프런티어
 * - 항목마다 fetch → 분류/기록 → 링크 추출/큐잉 → 스크립트 분석 → 고정 지연
 * - concurrency 만큼의 항목을 워커 풀에서 동시에 처리, 자식 큐잉은 제어 흐름에서만
 * - 큐잉 시점 check-and-mark로 URL당 정확히 한 번 처리(키는 fragment 없는 정규화 URL)
 *
 * 인스턴스 하나당 crawl()은 한 번만 호출할 수 있다.
 */
public class Crawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final CrawlEventLog ELOG = CrawlEventLog.of(Crawler.class);

    /** 완료 대기 폴링 주기: 취소 신호를 이 간격 안에 관측 */
    private static final long POLL_MS = 50L;

    private final CrawlConfig config;
    private final IFetcher fetcher;
    private final Sleeper sleeper;
    private final UrlValidator validator;
    private final EndpointClassifier classifier;
    private final LinkExtractor extractor;
    private final CrawlState state;
    private final ScriptAnalyzer scriptAnalyzer;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean used = new AtomicBoolean(false);
    private volatile boolean cancelled = false;

    public Crawler(CrawlConfig config) {
        this(config, new HttpFetcher(config), new DefaultSleeper(), FindingListener.NONE);
    }

    /** DI/테스트용 */
    public Crawler(CrawlConfig config, IFetcher fetcher, Sleeper sleeper, FindingListener findingListener) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = (sleeper != null) ? sleeper : Sleeper.NONE;
        this.validator = UrlValidator.forTarget(config.getTarget().trim());
        this.classifier = new EndpointClassifier();
        this.extractor = new JsoupLinkExtractor(validator);
        this.state = new CrawlState(findingListener);
        this.scriptAnalyzer = new ScriptAnalyzer(fetcher, config.getScriptTimeout(), validator, classifier, state);
    }

    public CrawlState getState() { return state; }

    /** 외부 중지 요청. 루프가 다음 반복에서 관측한다. */
    public void stop() { stopRequested.set(true); }

    /** 마지막 crawl()이 취소로 끝났는지 */
    public boolean wasCancelled() { return cancelled; }

    public CrawlState crawl() {
        return crawl(ProgressListener.NONE, null);
    }

    public CrawlState crawl(ProgressListener listener) {
        return crawl(listener, null);
    }

    /**
     * 큐가 비거나 취소될 때까지 크롤. 반환 전에 워커 풀과 진행 리포터를 모두 종료/대기한다.
     * @param cancelFlag 외부 취소 플래그(옵션)
     */
    public CrawlState crawl(ProgressListener listener, AtomicBoolean cancelFlag) {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("Crawler instance already used");
        }
        final int maxDepth = config.getEffectiveMaxDepth();
        final int cc = Math.max(1, config.getConcurrency());
        final URI seed = UrlUtils.normalize(URI.create(config.getTarget().trim()));

        Frontier frontier = new Frontier();
        frontier.offer(new FrontierEntry(seed, 0));
        state.markScheduled(seed.toString());
        state.updateQueued(frontier.size());

        ProgressReporter reporter = new ProgressReporter(state::snapshot, listener, config.getProgressInterval());
        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl-worker"));
        CompletionService<PageOutcome> cs = new ExecutorCompletionService<>(exec);
        int inFlight = 0;

        reporter.start();
        try {
            while (!isCancelled(cancelFlag)) {
                // 1) 빈 슬롯만큼 꺼내서 제출
                while (inFlight < cc && !frontier.isEmpty()) {
                    FrontierEntry e = frontier.poll();
                    if (!state.beginVisit(e, maxDepth, frontier.size())) continue; // 방문함/깊이 초과 → 버림
                    cs.submit(() -> processEntry(e, cancelFlag));
                    inFlight++;
                }
                if (inFlight == 0) break; // 큐 소진

                // 2) 완료 하나 수거 → 자식 큐잉
                Future<PageOutcome> done = cs.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (done == null) continue;
                inFlight--;

                for (FrontierEntry child : collect(done)) {
                    if (child.depth() > maxDepth) continue;
                    if (state.markScheduled(child.url().toString())) frontier.offer(child);
                }
                state.updateQueued(frontier.size());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
        } finally {
            cancelled = isCancelled(cancelFlag);
            shutdown(exec);
            reporter.stop();
        }
        return state;
    }

    /** 프런티어 항목 1개 처리(워커 스레드). 반환값은 큐잉 후보 자식들. */
    private PageOutcome processEntry(FrontierEntry entry, AtomicBoolean cancelFlag) throws InterruptedException {
        URI url = entry.url();
        FetchResult r = fetcher.fetch(url, config.getPageTimeout());
        if (!r.isSuccess()) {
            ELOG.event(CrawlEvent.FETCH_FAILED)
                    .with("url", url).with("depth", entry.depth())
                    .with("kind", r.getFailure()).with("message", r.getMessage())
                    .log();
            return PageOutcome.EMPTY;
        }
        ELOG.event(CrawlEvent.PAGE_FETCHED)
                .with("url", url).with("depth", entry.depth())
                .with("status", r.getResponse().getStatusCode())
                .with("ms", r.getResponse().getResponseTimeMs())
                .log();

        // 가져온 URL 자체 분류/기록
        state.recordEndpoint(url, classifier.classify(url));

        Document doc = Jsoup.parse(r.body(), url.toString());

        List<FrontierEntry> children = new ArrayList<>();
        for (URI link : extractor.extractLinks(doc, url)) {
            state.recordEndpoint(link, classifier.classify(link));
            URI next = UrlUtils.normalize(link); // #fragment 변형은 같은 페이지
            if (!state.isVisited(next.toString())) children.add(entry.child(next));
        }

        for (URI script : extractor.extractScriptSources(doc, url)) {
            checkCancel(cancelFlag);
            if (!config.isAnalyzeOffDomainScripts() && !validator.isValid(script)) continue;
            ScriptAnalysis a = scriptAnalyzer.analyze(script);
            state.recordFunctions(a.functions());
        }

        sleeper.sleep(config.getDelay());
        return new PageOutcome(children);
    }

    /** 항목 단위 실패는 로그만 남기고 크롤은 계속 */
    private List<FrontierEntry> collect(Future<PageOutcome> f) throws InterruptedException {
        try {
            return f.get().children();
        } catch (CancellationException ce) {
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            if (cause instanceof InterruptedException || cause instanceof CancellationException) {
                return List.of();
            }
            ELOG.event(CrawlEvent.ENTRY_FAILED).error(cause).log();
            return List.of();
        }
    }

    private boolean isCancelled(AtomicBoolean flag) {
        return stopRequested.get()
                || (flag != null && flag.get())
                || Thread.currentThread().isInterrupted();
    }

    private void checkCancel(AtomicBoolean flag) {
        if (isCancelled(flag)) throw new CancellationException();
    }

    private void shutdown(ExecutorService exec) {
        exec.shutdownNow();
        long waitMs = config.getPageTimeout().toMillis() + config.getScriptTimeout().toMillis() + 1_000L;
        try {
            if (!exec.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Crawl workers did not terminate within {} ms", waitMs);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private record PageOutcome(List<FrontierEntry> children) {
        static final PageOutcome EMPTY = new PageOutcome(List.of());
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
