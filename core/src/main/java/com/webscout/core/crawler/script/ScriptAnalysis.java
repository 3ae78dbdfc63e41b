package com.webscout.core.crawler.script;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 스크립트 1개 분석 결과.
 * endpoints는 이미 CrawlState에 기록된 것(로그/테스트 확인용)이고, functions는 호출자가 병합한다.
 */
public record ScriptAnalysis(Set<String> functions, List<String> endpoints) {
    public static final ScriptAnalysis EMPTY = new ScriptAnalysis(Set.of(), List.of());

    public ScriptAnalysis {
        // 알림 순서가 실행마다 같도록 삽입 순서 유지
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        endpoints = List.copyOf(endpoints);
    }

    public boolean isEmpty() { return functions.isEmpty() && endpoints.isEmpty(); }
}
