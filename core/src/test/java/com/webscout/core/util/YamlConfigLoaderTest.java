package com.webscout.core.util;

import com.webscout.core.model.CrawlConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("모든 키를 읽어 기본값을 덮어씀")
    void allKeys() throws IOException {
        Path file = tmp.resolve("crawl.yml");
        Files.writeString(file, String.join("\n",
                "target: \"http://ex.test:8080\"",
                "userAgent: \"ua-test/2\"",
                "followRedirects: false",
                "concurrency: 4",
                "scope:",
                "  maxDepth: 0",
                "timeouts:",
                "  pageMs: 2500",
                "  scriptMs: 800",
                "crawler:",
                "  delayMs: 0",
                "  progressIntervalMs: 50",
                "  analyzeOffDomainScripts: false",
                "output:",
                "  dir: \"reports\""));

        CrawlConfig c = YamlConfigLoader.load(file);

        assertThat(c.getTarget()).isEqualTo("http://ex.test:8080");
        assertThat(c.getUserAgent()).isEqualTo("ua-test/2");
        assertThat(c.isFollowRedirects()).isFalse();
        assertThat(c.getConcurrency()).isEqualTo(4);
        assertThat(c.isUnlimitedDepth()).isTrue();
        assertThat(c.getPageTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(c.getScriptTimeout()).isEqualTo(Duration.ofMillis(800));
        assertThat(c.getDelay()).isEqualTo(Duration.ZERO);
        assertThat(c.getProgressInterval()).isEqualTo(Duration.ofMillis(50));
        assertThat(c.isAnalyzeOffDomainScripts()).isFalse();
        assertThat(c.getOutputDir()).isEqualTo(Path.of("reports"));
    }

    @Test
    @DisplayName("일부 키만 있으면 나머지는 기본값, target 없어도 로드는 성공")
    void partialKeepsDefaults() {
        CrawlConfig c = YamlConfigLoader.load(yaml("scope:\n  maxDepth: 5\n"));

        assertThat(c.getMaxDepth()).isEqualTo(5);
        assertThat(c.getTarget()).isNull();
        assertThat(c.getDelay()).isEqualTo(CrawlConfig.defaults().getDelay());
    }

    @Test
    @DisplayName("빈 문서는 기본값")
    void emptyDocument() {
        assertThat(YamlConfigLoader.load(yaml("")).getMaxDepth()).isEqualTo(3);
    }

    @Test
    @DisplayName("숫자 자리의 문자열 숫자는 허용, 숫자가 아니면 키 이름과 함께 거절")
    void numericStrings() {
        assertThat(YamlConfigLoader.load(yaml("concurrency: \"2\"")).getConcurrency()).isEqualTo(2);
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("crawler:\n  delayMs: soon\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delayMs");
    }

    @Test
    @DisplayName("파일이 없으면 IOException")
    void missingFile() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("SafeConstructor: 임의 타입 태그는 거절")
    void unsafeTagRejected() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("target: !!java.io.File [\"/etc\"]")))
                .isInstanceOf(RuntimeException.class);
    }
}
