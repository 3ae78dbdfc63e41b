package com.webscout.core.crawler;

import com.webscout.core.api.IFetcher;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.model.FetchResult;
import com.webscout.core.model.HttpResponseData;
import com.webscout.core.model.ProgressSnapshot;
import com.webscout.core.util.ProgressListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Crawler: 취소 시 빠른 종료 + 진행 리포터 정지")
class CrawlerCancellationTest {

    /** /p{n} → /p{n+1} 로 끝없이 이어지는 사이트 */
    private static final IFetcher ENDLESS = (url, timeout) -> {
        String path = url.getPath();
        int n = path.startsWith("/p") ? Integer.parseInt(path.substring(2)) : 0;
        String body = "<a href=\"/p" + (n + 1) + "\">next</a><a href=\"/api/item" + n + ".json\">j</a>";
        return FetchResult.success(HttpResponseData.builder().url(url).statusCode(200).body(body).build());
    };

    private static CrawlConfig cfg() {
        return CrawlConfig.defaults()
                .setTarget("http://loop.test/p0")
                .setMaxDepth(0)
                .setDelayMs(5)
                .setProgressIntervalMs(20);
    }

    @Test
    @Timeout(10)
    @DisplayName("외부 취소 플래그 → 반환, wasCancelled, 반환 후 진행 콜백 없음")
    void cancelFlag_stopsCrawlAndReporter() throws Exception {
        AtomicBoolean cancel = new AtomicBoolean(false);
        AtomicInteger ticks = new AtomicInteger();
        AtomicReference<ProgressSnapshot> last = new AtomicReference<>();
        ProgressListener pl = new ProgressListener() {
            @Override public void onProgress(ProgressSnapshot s) { ticks.incrementAndGet(); }
            @Override public void onFinished(ProgressSnapshot s) { last.set(s); }
        };

        Crawler crawler = new Crawler(cfg(), ENDLESS, d -> Thread.sleep(d.toMillis()), FindingListener.NONE);
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        try {
            timer.schedule(() -> cancel.set(true), 200, TimeUnit.MILLISECONDS);
            CrawlState st = crawler.crawl(pl, cancel);

            assertThat(crawler.wasCancelled()).isTrue();
            assertThat(last.get()).isNotNull();
            assertThat(st.snapshot().crawled).isPositive();

            int afterReturn = ticks.get();
            Thread.sleep(100); // 리포터 주기(20ms)의 5배
            assertThat(ticks.get()).isEqualTo(afterReturn);
        } finally {
            timer.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("stop() 호출 후 기록된 항목은 모두 온전한 URL")
    void stop_leavesOnlyWholeEntries() throws Exception {
        Crawler crawler = new Crawler(cfg().setConcurrency(3), ENDLESS,
                d -> Thread.sleep(d.toMillis()), FindingListener.NONE);
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        try {
            timer.schedule(crawler::stop, 150, TimeUnit.MILLISECONDS);
            CrawlState st = crawler.crawl();

            assertThat(crawler.wasCancelled()).isTrue();
            assertThat(st.htmlPages()).allMatch(u -> u.matches("http://loop\\.test/p\\d+"));
            assertThat(st.backendEndpoints()).allMatch(u -> u.matches("http://loop\\.test/api/item\\d+\\.json"));
            // 열린 페이지마다 백엔드 링크 하나
            assertThat(st.backendEndpoints().size()).isGreaterThanOrEqualTo(1);
        } finally {
            timer.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("이미 취소된 플래그로 시작하면 아무 것도 fetch하지 않음")
    void preCancelled_fetchesNothing() {
        AtomicInteger fetches = new AtomicInteger();
        IFetcher counting = (url, timeout) -> {
            fetches.incrementAndGet();
            return ENDLESS.fetch(url, timeout);
        };
        Crawler crawler = new Crawler(cfg(), counting, d -> { }, FindingListener.NONE);

        crawler.crawl(ProgressListener.NONE, new AtomicBoolean(true));

        assertThat(fetches.get()).isZero();
        assertThat(crawler.wasCancelled()).isTrue();
    }

    @Test
    @DisplayName("취소 없이 끝나면 wasCancelled=false")
    void finishedNormally_notCancelled() {
        IFetcher single = (url, timeout) -> FetchResult.success(
                HttpResponseData.builder().url(url).statusCode(200).body("<p>leaf</p>").build());
        Crawler crawler = new Crawler(cfg().setDelay(Duration.ZERO), single, d -> { }, FindingListener.NONE);
        crawler.crawl();
        assertThat(crawler.wasCancelled()).isFalse();
    }
}
