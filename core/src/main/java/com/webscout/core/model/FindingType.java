package com.webscout.core.model;

import java.util.Locale;

/** 최초 발견 알림 종류 */
public enum FindingType {
    HTML,
    BACKEND,
    FUNCTION;

    /** 콘솔 표기용: "Html", "Backend", "Function" */
    public String label() {
        String n = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
}
