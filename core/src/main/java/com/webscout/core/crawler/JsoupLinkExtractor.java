package com.webscout.core.crawler;

import com.webscout.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** jsoup 기반 링크 추출기: 요소 종류별 속성 → abs: 해석 → UrlValidator 필터 */
public class JsoupLinkExtractor implements LinkExtractor {

    /** 요소별로 읽을 속성 */
    static final Map<String, String> ATTR_BY_TAG = Map.of(
            "a", "href",
            "link", "href",
            "script", "src",
            "frame", "src",
            "iframe", "src",
            "form", "action");

    private static final String LINK_QUERY =
            "a[href], link[href], script[src], frame[src], iframe[src], form[action]";

    private final UrlValidator validator;

    public JsoupLinkExtractor(UrlValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    @Override
    public Set<URI> extractLinks(Document doc, URI base) {
        Set<URI> out = new LinkedHashSet<>();   // 문서 순서 유지(결정적 BFS)
        if (doc == null || base == null) return out;
        ensureBaseUri(doc, base);

        for (Element el : doc.select(LINK_QUERY)) {
            String attr = ATTR_BY_TAG.get(el.normalName());
            if (attr == null) continue;
            URI u = absolute(el, attr);
            if (u != null && validator.isValid(u)) out.add(u);
        }
        return out;
    }

    @Override
    public List<URI> extractScriptSources(Document doc, URI base) {
        List<URI> out = new ArrayList<>();
        if (doc == null || base == null) return out;
        ensureBaseUri(doc, base);

        for (Element el : doc.select("script[src]")) {
            URI u = absolute(el, "src");
            if (u == null || u.getScheme() == null) continue;
            String s = u.getScheme().toLowerCase(Locale.ROOT);
            if ((s.equals("http") || s.equals("https")) && !out.contains(u)) out.add(u);
        }
        return out;
    }

    /** base 없이 파싱된 문서면 페이지 URL을 base로 */
    private static void ensureBaseUri(Document doc, URI base) {
        if (doc.baseUri().isEmpty()) doc.setBaseUri(base.toString());
    }

    private static URI absolute(Element el, String attr) {
        String abs = el.absUrl(attr);
        if (abs.isEmpty()) return null; // 해석 불가
        return UrlUtils.toUri(abs);
    }
}
