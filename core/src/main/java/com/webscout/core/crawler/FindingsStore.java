package com.webscout.core.crawler;

import com.webscout.core.model.FindingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 중복 제거된 세 컨테이너(html / backend / function) + 최초 발견 알림.
 * 자체 동기화는 없다. 반드시 CrawlState 락 안에서만 접근한다.
 */
final class FindingsStore {

    private static final Logger LOG = LoggerFactory.getLogger(FindingsStore.class);

    private final Set<String> htmlPages = new LinkedHashSet<>();
    private final Set<String> backendEndpoints = new LinkedHashSet<>();
    private final Set<String> functions = new LinkedHashSet<>();
    private final FindingListener listener;

    FindingsStore(FindingListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * canonical key 기록. html/backend는 서로 배타적이라 한쪽에 있으면 다른 쪽에 넣지 않는다(먼저 본 쪽 유지).
     * @return 새로 추가됐으면 true
     */
    boolean addEndpoint(FindingType type, String canonicalKey) {
        Set<String> target;
        Set<String> other;
        switch (type) {
            case HTML -> { target = htmlPages; other = backendEndpoints; }
            case BACKEND -> { target = backendEndpoints; other = htmlPages; }
            default -> throw new IllegalArgumentException("not an endpoint type: " + type);
        }
        if (other.contains(canonicalKey) || !target.add(canonicalKey)) return false;
        notifyListener(type, canonicalKey);
        return true;
    }

    boolean addFunction(String name) {
        if (!functions.add(name)) return false;
        notifyListener(FindingType.FUNCTION, name);
        return true;
    }

    private void notifyListener(FindingType type, String value) {
        try {
            listener.onFinding(type, value);
        } catch (RuntimeException e) {
            // 표시 계층 오류가 수집을 막지 않도록 기록만 남김
            LOG.warn("Finding listener failed for {} {}: {}", type, value, e.toString());
        }
    }

    int htmlCount() { return htmlPages.size(); }
    int backendCount() { return backendEndpoints.size(); }
    int functionCount() { return functions.size(); }

    List<String> htmlPages() { return new ArrayList<>(htmlPages); }
    List<String> backendEndpoints() { return new ArrayList<>(backendEndpoints); }
    List<String> functions() { return new ArrayList<>(functions); }
}
