package com.webscout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** 최종 보고서 (JSON 포맷: target / html_pages / backend_endpoints / functions / stats) */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"target", "html_pages", "backend_endpoints", "functions", "stats"})
public final class CrawlReport {

    @JsonPropertyOrder({"total_html", "total_backend", "total_functions", "max_depth"})
    public static final class Stats {
        @JsonProperty("total_html")      public int totalHtml;
        @JsonProperty("total_backend")   public int totalBackend;
        @JsonProperty("total_functions") public int totalFunctions;
        @JsonProperty("max_depth")       public int maxDepth;
    }

    @JsonProperty("target")            public String target;
    @JsonProperty("html_pages")        public List<String> htmlPages = List.of();
    @JsonProperty("backend_endpoints") public List<String> backendEndpoints = List.of();
    @JsonProperty("functions")         public List<String> functions = List.of();
    @JsonProperty("stats")             public Stats stats = new Stats();

    /** 정렬된 목록 + 통계로 보고서 구성 */
    public static CrawlReport of(String target, int maxDepth,
                                 Collection<String> html,
                                 Collection<String> backend,
                                 Collection<String> functions) {
        CrawlReport r = new CrawlReport();
        r.target = target;
        r.htmlPages = sorted(html);
        r.backendEndpoints = sorted(backend);
        r.functions = sorted(functions);
        r.stats.totalHtml = r.htmlPages.size();
        r.stats.totalBackend = r.backendEndpoints.size();
        r.stats.totalFunctions = r.functions.size();
        r.stats.maxDepth = maxDepth;
        return r;
    }

    private static List<String> sorted(Collection<String> in) {
        List<String> out = new ArrayList<>(in == null ? List.of() : in);
        out.sort(null);
        return List.copyOf(out);
    }
}
