package com.webscout.core.crawler;

import com.webscout.core.util.UrlUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 도메인/스킴 판정: authority(host[:port])가 대상과 정확히 같고 http/https일 때만 유효.
 * 대소문자·기본 포트 정규화는 하지 않는다.
 */
public final class UrlValidator {

    private final String authority;

    public UrlValidator(String targetAuthority) {
        this.authority = Objects.requireNonNull(targetAuthority, "targetAuthority");
    }

    /** 시작 URL에서 authority를 뽑아 생성 */
    public static UrlValidator forTarget(String targetUrl) {
        URI u = UrlUtils.toUri(targetUrl);
        if (u == null || u.getRawAuthority() == null) {
            throw new IllegalArgumentException("target has no authority: " + targetUrl);
        }
        return new UrlValidator(u.getRawAuthority());
    }

    public String getAuthority() { return authority; }

    public boolean isValid(String url) {
        return isValid(UrlUtils.toUri(url));
    }

    public boolean isValid(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        if (!s.equals("http") && !s.equals("https")) return false;
        return authority.equals(u.getRawAuthority());
    }
}
