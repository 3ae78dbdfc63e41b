package com.webscout.core.model;

/** 진행 상황 불변 스냅샷. CrawlState 락 안에서만 만들어진다. */
public final class ProgressSnapshot {
    public static final ProgressSnapshot EMPTY = new ProgressSnapshot(0, 0, 0, 0, 0, 0);

    public final long crawled;
    public final int queued;
    public final int depth;
    public final int htmlCount;
    public final int backendCount;
    public final int functionCount;

    public ProgressSnapshot(long crawled, int queued, int depth,
                            int htmlCount, int backendCount, int functionCount) {
        this.crawled = crawled;
        this.queued = queued;
        this.depth = depth;
        this.htmlCount = htmlCount;
        this.backendCount = backendCount;
        this.functionCount = functionCount;
    }

    @Override public String toString() {
        return "Crawled: " + crawled + " | Queued: " + queued + " | Depth: " + depth
                + " | HTML: " + htmlCount + " | Backend: " + backendCount
                + " | Functions: " + functionCount;
    }
}
