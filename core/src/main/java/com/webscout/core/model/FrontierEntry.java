package com.webscout.core.model;

import java.net.URI;
import java.util.Objects;

/** 프런티어 항목: (url, depth). 자식 깊이는 항상 부모 + 1 */
public record FrontierEntry(URI url, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public FrontierEntry child(URI link) {
        return new FrontierEntry(link, depth + 1);
    }
}
