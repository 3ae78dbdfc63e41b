package com.webscout.core.crawler.script;

import com.webscout.core.api.IFetcher;
import com.webscout.core.crawler.CrawlState;
import com.webscout.core.crawler.EndpointClassifier;
import com.webscout.core.crawler.UrlValidator;
import com.webscout.core.crawler.script.ScriptLexer.Token;
import com.webscout.core.model.EndpointCategory;
import com.webscout.core.model.FetchResult;
import com.webscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 스크립트 분석기: fetch(짧은 타임아웃) → 토큰화 → API 호출 대상/선언 식별자 추출.
 * API 호출 대상은 스크립트 URL 기준으로 해석해 도메인 필터 + 분류 후 CrawlState에 바로 기록한다.
 * fetch 실패는 빈 결과.
 */
public class ScriptAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptAnalyzer.class);

    private final IFetcher fetcher;
    private final Duration timeout;
    private final UrlValidator validator;
    private final EndpointClassifier classifier;
    private final CrawlState state;

    public ScriptAnalyzer(IFetcher fetcher, Duration timeout, UrlValidator validator,
                          EndpointClassifier classifier, CrawlState state) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.state = Objects.requireNonNull(state, "state");
    }

    public ScriptAnalysis analyze(URI scriptUrl) {
        FetchResult r = fetcher.fetch(scriptUrl, timeout);
        if (!r.isSuccess()) {
            LOG.debug("Script fetch failed: {} ({}: {})", scriptUrl, r.getFailure(), r.getMessage());
            return ScriptAnalysis.EMPTY;
        }
        return analyzeSource(scriptUrl, r.body());
    }

    /** 이미 받은 소스 분석(fetch 없음) */
    public ScriptAnalysis analyzeSource(URI scriptUrl, String source) {
        List<Token> tokens = ScriptLexer.tokenize(source);

        List<String> endpoints = new ArrayList<>();
        for (String target : ScriptHeuristics.apiCallTargets(tokens)) {
            URI u = UrlUtils.toUri(UrlUtils.resolve(scriptUrl.toString(), target));
            if (u == null || !validator.isValid(u)) continue;

            EndpointCategory category = classifier.classify(u);
            if (category == EndpointCategory.UNKNOWN) continue;
            state.recordEndpoint(u, category);
            endpoints.add(u.toString());
        }

        ScriptAnalysis a = new ScriptAnalysis(ScriptHeuristics.declaredFunctions(tokens), endpoints);
        LOG.debug("Script analyzed: {} -> endpoints={}, functions={}",
                scriptUrl, a.endpoints().size(), a.functions().size());
        return a;
    }
}
