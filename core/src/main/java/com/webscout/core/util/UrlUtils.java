package com.webscout.core.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

/** URL 정규화(canonical key, 스케줄링 키) + 상대 참조 해석 유틸 */
public final class UrlUtils {
    private UrlUtils() {}

    /**
     * canonical key: query('?' 이후)와 fragment('#' 이후)를 잘라낸 문자열.
     * 그 외(대소문자, 기본 포트, 경로)는 손대지 않는다. 멱등.
     */
    public static String canonicalize(String url) {
        if (url == null) return null;
        String s = url;
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        int h = s.indexOf('#');
        if (h >= 0) s = s.substring(0, h);
        return s;
    }

    public static String canonicalize(URI url) {
        return url == null ? null : canonicalize(url.toString());
    }

    /**
     * base 기준으로 ref를 절대 URL로 해석. 해석 불가(미지원 프로토콜 등)면 null.
     * "?a=b" 처럼 쿼리만 있는 참조는 base 경로를 유지한다.
     */
    public static String resolve(String base, String ref) {
        if (base == null || ref == null) return null;
        String r = ref.trim();
        try {
            URL b = new URL(base);
            if (r.startsWith("?")) r = b.getPath() + r;
            return new URL(b, r).toExternalForm();
        } catch (MalformedURLException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * 스케줄링 키 정규화:
     * - fragment 제거(#... 제거)
     * - 빈 경로를 "/"로
     * scheme/authority/query는 그대로 둔다(도메인 판정은 원문 authority 기준).
     */
    public static URI normalize(URI u) {
        if (u == null || u.isOpaque() || u.getRawAuthority() == null) return u;
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        if (u.getRawFragment() == null && path.equals(u.getRawPath())) return u;

        StringBuilder sb = new StringBuilder()
                .append(u.getScheme()).append("://").append(u.getRawAuthority()).append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return URI.create(sb.toString());
    }

    /**
     * 문자열 → URI. 공백, '|', '{}' 처럼 브라우저는 받아주지만 URI 문법에 없는 문자는
     * 퍼센트 인코딩해서 받아들인다. 이미 인코딩된 %XX는 유지. 해석 불가면 null.
     */
    public static URI toUri(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        try {
            return new URI(t);
        } catch (URISyntaxException e) {
            return quoted(t);
        }
    }

    private static URI quoted(String s) {
        try {
            URL u = new URL(s);
            // 다중 인자 생성자가 불법 문자를 인용한다
            return new URI(u.getProtocol(), u.getUserInfo(), u.getHost(), u.getPort(),
                    u.getPath(), u.getQuery(), u.getRef());
        } catch (MalformedURLException | URISyntaxException e) {
            return null;
        }
    }
}
