package com.webscout.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;

/** 보고서 파일명 규칙: {@code <authority의 ':'를 '_'로>_security_scan.json} */
public final class ReportNaming {

    public static final String SUFFIX = "_security_scan.json";

    private ReportNaming() {}

    public static String fileName(String target) {
        return slug(target) + SUFFIX;
    }

    public static Path jsonPath(Path baseDir, String target) {
        Path out = (baseDir == null ? Paths.get(".") : baseDir);
        return out.resolve(fileName(target));
    }

    // ===== helpers =====
    private static String slug(String target) {
        if (target == null || target.isBlank()) return "unknown-host";
        String authority;
        try {
            authority = URI.create(target.trim()).getRawAuthority();
        } catch (IllegalArgumentException e) {
            authority = null;
        }
        if (authority == null || authority.isBlank()) return "unknown-host";
        // 경로 구분자 등 파일명에 못 쓰는 문자는 '-'로
        return authority.replace(':', '_').replaceAll("[\\\\/*?\"<>|]", "-");
    }
}
