package com.webscout.core.util;

import java.util.logging.Level;

/** 크롤 이벤트 종류. JSON의 "event" 값과 JUL 레벨이 여기서 고정된다. */
public enum CrawlEvent {
    CRAWL_START("crawl-start", Level.INFO),
    PAGE_FETCHED("page-fetched", Level.FINE),
    FETCH_FAILED("fetch-failed", Level.FINE),
    ENTRY_FAILED("entry-failed", Level.WARNING),
    CRAWL_DONE("crawl-done", Level.INFO);

    private final String wireName;
    private final Level level;

    CrawlEvent(String wireName, Level level) {
        this.wireName = wireName;
        this.level = level;
    }

    public String wireName() { return wireName; }

    public Level level() { return level; }
}
