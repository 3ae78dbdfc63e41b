package com.webscout.core.service;

import com.webscout.core.crawler.FindingListener;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.model.CrawlReport;
import com.webscout.core.model.FindingType;
import com.webscout.core.model.ProgressSnapshot;
import com.webscout.core.service.export.JsonReportExporter;
import com.webscout.core.util.ProgressListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrawlService: 로컬 HTTP 사이트 대상 통합")
class CrawlServiceIntegrationTest {

    private TestSite site;
    private String base;

    @TempDir
    Path tmp;

    @BeforeEach
    void up() throws Exception {
        site = new TestSite();
        base = site.base();
    }

    @AfterEach
    void down() {
        site.close();
    }

    private CrawlConfig cfg(int depth) {
        return CrawlConfig.defaults()
                .setTarget(base + "/")
                .setMaxDepth(depth)
                .setDelayMs(0)
                .setProgressIntervalMs(20)
                .setPageTimeoutMs(3_000)
                .setScriptTimeoutMs(3_000)
                .setOutputDir(tmp);
    }

    @Test
    @Timeout(20)
    @DisplayName("depth=1: 세 종류 발견 + 정렬된 보고서 + 알림 스트림 일치")
    void depthOne_fullPipeline() throws Exception {
        List<String> notified = new CopyOnWriteArrayList<>();
        FindingListener fl = (t, v) -> notified.add(t + ":" + v);
        AtomicReference<ProgressSnapshot> last = new AtomicReference<>();
        ProgressListener pl = new ProgressListener() {
            @Override public void onProgress(ProgressSnapshot s) { }
            @Override public void onFinished(ProgressSnapshot s) { last.set(s); }
        };

        CrawlService svc = new CrawlService(cfg(1), fl);
        CrawlReport r = svc.run(pl);

        assertThat(r.target).isEqualTo(base + "/");
        assertThat(r.backendEndpoints).containsExactly(base + "/api/orders", base + "/api/users");
        assertThat(r.htmlPages).containsExactly(
                base + "/about.html", base + "/contact", base + "/docs", base + "/docs/deep");
        assertThat(r.functions).containsExactly("CONFIG_URL", "loadData");
        assertThat(r.stats.maxDepth).isEqualTo(1);

        assertThat(notified).contains(FindingType.FUNCTION + ":loadData")
                .hasSize(r.stats.totalHtml + r.stats.totalBackend + r.stats.totalFunctions);
        assertThat(notified).noneMatch(s -> s.contains("other.test"));

        // 깊이 1 까지만 요청: /contact, /docs/deep 은 기록만
        assertThat(site.hits("/contact")).isZero();
        assertThat(site.hits("/docs/deep")).isZero();
        assertThat(site.hits("/about.html")).isEqualTo(1);

        assertThat(last.get()).isNotNull();
        assertThat(last.get().crawled).isEqualTo(svc.getProgressSnapshot().crawled);
        assertThat(svc.wasCancelled()).isFalse();

        Path out = new JsonReportExporter().export(tmp, r);
        assertThat(Files.readString(out)).contains("\"backend_endpoints\"");
    }

    @Test
    @Timeout(20)
    @DisplayName("depth=0(무제한), 동시성 3: 모든 페이지 정확히 한 번 요청")
    void unlimited_concurrent_eachPageOnce() {
        CrawlReport r = new CrawlService(cfg(0).setConcurrency(3)).run();

        assertThat(site.hits("/")).isEqualTo(1);
        assertThat(site.hits("/contact")).isEqualTo(1);
        assertThat(site.hits("/docs/deep")).isEqualTo(1);
        // 페이지 링크로 한 번 + 스크립트 분석으로 한 번
        assertThat(site.hits("/static/app.js")).isEqualTo(2);
        assertThat(r.backendEndpoints).contains(base + "/contact.php");
    }

    @Test
    @DisplayName("잘못된 설정은 생성 시점에 거절")
    void invalidConfig_rejected() {
        assertThatThrownBy(() -> new CrawlService(CrawlConfig.defaults().setTarget("ftp://nope/")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CrawlService(CrawlConfig.defaults()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @Timeout(20)
    @DisplayName("서버가 없는 대상 → 빈 보고서로 정상 종료")
    void deadTarget_emptyReport() {
        site.close();
        CrawlReport r = new CrawlService(cfg(2)).run();

        assertThat(r.htmlPages).isEmpty();
        assertThat(r.backendEndpoints).isEmpty();
        assertThat(r.functions).isEmpty();
    }
}
