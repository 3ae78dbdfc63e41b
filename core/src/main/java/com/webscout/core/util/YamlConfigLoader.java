package com.webscout.core.util;

import com.webscout.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "http://example.com"
 * userAgent: "WebScout/0.1 (+crawler)"
 * followRedirects: true
 * concurrency: 1
 * scope:
 *   maxDepth: 3        # 0 = 무제한
 * timeouts:
 *   pageMs: 10000
 *   scriptMs: 5000
 * crawler:
 *   delayMs: 500
 *   progressIntervalMs: 100
 *   analyzeOffDomainScripts: true
 * output:
 *   dir: "."
 *
 * target은 CLI에서 줄 수 있으므로 여기서는 validate()를 하지 않는다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CrawlConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "concurrency", cfg::setConcurrency);

        // 2) scope.maxDepth
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
        }

        // 3) timeouts.*
        Map<String, Object> timeouts = getMap(map, "timeouts");
        if (timeouts != null) {
            setLong(timeouts, "pageMs", cfg::setPageTimeoutMs);
            setLong(timeouts, "scriptMs", cfg::setScriptTimeoutMs);
        }

        // 4) crawler.*
        Map<String, Object> crawler = getMap(map, "crawler");
        if (crawler != null) {
            setLong(crawler, "delayMs", cfg::setDelayMs);
            setLong(crawler, "progressIntervalMs", cfg::setProgressIntervalMs);
            setBoolean(crawler, "analyzeOffDomainScripts", cfg::setAnalyzeOffDomainScripts);
        }

        // 5) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, String.valueOf(v)));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parseInt(key, String.valueOf(v)));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static int parseInt(String key, String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + s, e);
        }
    }
}
