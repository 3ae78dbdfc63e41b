package com.webscout.core.crawler;

import com.webscout.core.model.FrontierEntry;

import java.util.ArrayDeque;
import java.util.Deque;

/** FIFO 프런티어(BFS). 크롤 제어 흐름 하나만 접근하므로 동기화하지 않는다. */
final class Frontier {
    private final Deque<FrontierEntry> q = new ArrayDeque<>();

    void offer(FrontierEntry e) { q.addLast(e); }
    FrontierEntry poll() { return q.pollFirst(); }
    boolean isEmpty() { return q.isEmpty(); }
    int size() { return q.size(); }
}
