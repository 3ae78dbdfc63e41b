package com.webscout.core.crawler;

import com.webscout.core.model.FindingType;

/**
 * 최초 발견 알림. CrawlState 락 안에서 호출되므로 빠르게 끝나야 한다.
 * 같은 키/이름에 대해 두 번 호출되지 않는다.
 */
@FunctionalInterface
public interface FindingListener {
    void onFinding(FindingType type, String value);

    FindingListener NONE = (t, v) -> {};
}
