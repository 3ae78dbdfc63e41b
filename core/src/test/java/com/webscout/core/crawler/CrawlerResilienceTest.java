package com.webscout.core.crawler;

import com.webscout.core.api.IFetcher;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.util.CrawlEventLog;
import com.webscout.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Crawler: 항목 단위 실패에도 탐색 계속")
class CrawlerResilienceTest {

    private static final String SEED = "http://ex.test/";

    private static CrawlConfig cfg() {
        return CrawlConfig.defaults().setTarget(SEED).setMaxDepth(0).setDelayMs(0);
    }

    @Test
    @DisplayName("seed fetch 실패 → 발견 없음, 정상 종료")
    void seedFetchFails_emptyFindings() {
        FakeFetcher f = new FakeFetcher(); // 아무 것도 등록 안 함
        Crawler c = new Crawler(cfg(), f, Sleeper.NONE, FindingListener.NONE);
        CrawlState st = c.crawl();

        assertThat(f.calls()).containsExactly(SEED);
        assertThat(st.htmlPages()).isEmpty();
        assertThat(st.backendEndpoints()).isEmpty();
        assertThat(st.functions()).isEmpty();
        assertThat(st.snapshot().crawled).isEqualTo(1);
        assertThat(c.wasCancelled()).isFalse();
    }

    @Test
    @DisplayName("/bad 에서 fetcher가 런타임 예외 → /ok 경로의 /deep 까지는 도달")
    void runtimeExceptionInOneEntry_doesNotStopCrawl() {
        FakeFetcher graph = new FakeFetcher()
                .page(SEED, FakeFetcher.links("/ok", "/bad"))
                .page("http://ex.test/ok", FakeFetcher.links("/deep"))
                .page("http://ex.test/deep", FakeFetcher.links());
        IFetcher throwing = (url, timeout) -> {
            if (url.getPath().equals("/bad")) throw new IllegalStateException("boom");
            return graph.fetch(url, timeout);
        };

        CrawlState st = new Crawler(cfg(), throwing, Sleeper.NONE, FindingListener.NONE).crawl();

        assertThat(graph.calls()).contains("http://ex.test/deep");
        assertThat(st.htmlPages()).contains("http://ex.test/ok", "http://ex.test/bad", "http://ex.test/deep");
    }

    @Test
    @DisplayName("항목 실패는 entry-failed 이벤트 1건(WARNING)으로만 남음")
    void runtimeExceptionInOneEntry_loggedOnce() {
        Logger events = Logger.getLogger(CrawlEventLog.LOGGER_NAME);
        List<LogRecord> warnings = Collections.synchronizedList(new ArrayList<>());
        Handler capture = new Handler() {
            @Override public void publish(LogRecord r) {
                if (r.getLevel().intValue() >= Level.WARNING.intValue()) warnings.add(r);
            }
            @Override public void flush() {}
            @Override public void close() {}
        };
        events.addHandler(capture);
        try {
            IFetcher throwing = (url, timeout) -> { throw new IllegalStateException("boom"); };
            new Crawler(cfg(), throwing, Sleeper.NONE, FindingListener.NONE).crawl();
        } finally {
            events.removeHandler(capture);
        }

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).contains("\"event\":\"entry-failed\"", "\"message\":\"boom\"");
        assertThat(warnings.get(0).getThrown()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("도달 불가 스크립트 → 함수/엔드포인트 기여 없이 나머지 크롤 계속")
    void unreachableScript_isIgnored() {
        FakeFetcher f = new FakeFetcher()
                .page(SEED, "<script src=\"/gone.js\"></script><a href=\"/next\">n</a>")
                .page("http://ex.test/next", "<script src=\"/ok.js\"></script>")
                .page("http://ex.test/ok.js", "const handler = 1;");

        CrawlState st = new Crawler(cfg(), f, Sleeper.NONE, FindingListener.NONE).crawl();

        assertThat(f.calls()).contains("http://ex.test/gone.js", "http://ex.test/next");
        assertThat(st.functions()).containsExactly("handler");
        assertThat(st.backendEndpoints()).isEmpty();
    }

    @Test
    @DisplayName("발견 리스너가 예외를 던져도 수집은 계속")
    void throwingListener_doesNotBreakCollection() {
        FakeFetcher f = new FakeFetcher()
                .page(SEED, FakeFetcher.links("/a", "/b"))
                .page("http://ex.test/a", FakeFetcher.links())
                .page("http://ex.test/b", FakeFetcher.links());
        FindingListener bad = (t, v) -> { throw new RuntimeException("ui down"); };

        CrawlState st = new Crawler(cfg(), f, Sleeper.NONE, bad).crawl();

        assertThat(st.htmlPages()).containsExactly("http://ex.test/a", "http://ex.test/b");
        assertThat(f.calls()).hasSize(3);
    }
}
