package com.webscout.core.model;

/** URL 분류 결과. UNKNOWN은 수집 대상이 아니지만 탐색(큐잉)에는 쓰인다. */
public enum EndpointCategory {
    HTML,
    BACKEND,
    UNKNOWN;

    /** 수집 가능한 분류면 대응 FindingType, 아니면 null */
    public FindingType toFindingType() {
        return switch (this) {
            case HTML -> FindingType.HTML;
            case BACKEND -> FindingType.BACKEND;
            case UNKNOWN -> null;
        };
    }
}
