package com.webscout.core.crawler;

import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.List;
import java.util.Set;

/** 파싱된 문서에서 후보 URL을 뽑는 전략 인터페이스. fetch나 재귀는 하지 않는다. */
public interface LinkExtractor {

    /** a/link[href], script/frame/iframe[src], form[action] → 도메인 필터를 통과한 절대 URL 집합 */
    Set<URI> extractLinks(Document doc, URI base);

    /** script[src] → http/https 절대 URL 목록(도메인 필터 없음, 문서 순서) */
    List<URI> extractScriptSources(Document doc, URI base);
}
