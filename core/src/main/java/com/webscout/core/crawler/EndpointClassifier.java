package com.webscout.core.crawler;

import com.webscout.core.model.EndpointCategory;
import com.webscout.core.util.UrlUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * URL 분류기. 규칙은 순서대로 평가한다:
 * 1) backend: 확장자(json/xml/ashx/asmx/php/jsp/do/action/api/rest), /api/·/ws/·/rest/ 경로,
 *    쿼리 키(action/method/api_key), .cgi
 * 2) html: 확장자(html/htm/asp/aspx/cfm), 또는 확장자 없는 마지막 경로 세그먼트
 * 3) 나머지는 UNKNOWN
 *
 * host는 보지 않는다(경로 + 쿼리만). 대소문자 무시.
 */
public final class EndpointClassifier {

    private static final Pattern BACKEND_EXT = Pattern.compile(
            "\\.(json|xml|ashx|asmx|php|jsp|do|action|api|rest)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BACKEND_DIR = Pattern.compile(
            "/(api|ws|rest)/", Pattern.CASE_INSENSITIVE);
    private static final Pattern CGI = Pattern.compile(
            "\\.cgi\\b", Pattern.CASE_INSENSITIVE);
    private static final Set<String> BACKEND_PARAMS = Set.of("action", "method", "api_key");

    private static final Pattern PAGE_EXT = Pattern.compile(
            "\\.(html|htm|asp|aspx|cfm)\\b", Pattern.CASE_INSENSITIVE);

    public EndpointCategory classify(String url) {
        return classify(UrlUtils.toUri(url));
    }

    public EndpointCategory classify(URI u) {
        if (u == null) return EndpointCategory.UNKNOWN;
        String path = u.getRawPath() == null ? "" : u.getRawPath();
        String query = u.getRawQuery();
        String pathAndQuery = query == null ? path : path + "?" + query;

        if (BACKEND_EXT.matcher(pathAndQuery).find()
                || BACKEND_DIR.matcher(pathAndQuery).find()
                || hasBackendParam(query)
                || CGI.matcher(pathAndQuery).find()) {
            return EndpointCategory.BACKEND;
        }
        if (PAGE_EXT.matcher(pathAndQuery).find() || isExtensionless(path)) {
            return EndpointCategory.HTML;
        }
        return EndpointCategory.UNKNOWN;
    }

    private static boolean hasBackendParam(String query) {
        if (query == null || query.isEmpty()) return false;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            if (BACKEND_PARAMS.contains(pair.substring(0, eq).toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    /** "/about", "/a/b" → true / "/", "", "/app.js" → false */
    private static boolean isExtensionless(String path) {
        if (path.isEmpty() || path.endsWith("/")) return false;
        String last = path.substring(path.lastIndexOf('/') + 1);
        return !last.isEmpty() && last.indexOf('.') < 0;
    }
}
