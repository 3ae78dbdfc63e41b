package com.webscout.core.crawler;

import com.webscout.core.api.IFetcher;
import com.webscout.core.model.FetchResult;
import com.webscout.core.model.FetchResult.FailureKind;
import com.webscout.core.model.HttpResponseData;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** URL 문자열 → 본문 맵 기반 fetcher. 등록 안 된 URL은 NETWORK 실패. 호출 순서 기록. */
final class FakeFetcher implements IFetcher {

    private final Map<String, String> bodies = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    FakeFetcher page(String url, String body) {
        bodies.put(url, body);
        return this;
    }

    @Override
    public FetchResult fetch(URI url, Duration timeout) {
        String key = url.toString();
        calls.add(key);
        String body = bodies.get(key);
        if (body == null) return FetchResult.failure(url, FailureKind.NETWORK, "no stub");
        return FetchResult.success(HttpResponseData.builder()
                .url(url).statusCode(200).body(body).contentType("text/html").build());
    }

    List<String> calls() {
        synchronized (calls) { return new ArrayList<>(calls); }
    }

    long count(String url) {
        return calls().stream().filter(url::equals).count();
    }

    /** a 태그 링크만 있는 간단한 페이지 */
    static String links(String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">x</a>");
        return sb.append("</body></html>").toString();
    }
}
