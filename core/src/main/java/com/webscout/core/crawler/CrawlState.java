package com.webscout.core.crawler;

import com.webscout.core.model.CrawlReport;
import com.webscout.core.model.EndpointCategory;
import com.webscout.core.model.FindingType;
import com.webscout.core.model.FrontierEntry;
import com.webscout.core.model.ProgressSnapshot;
import com.webscout.core.util.UrlUtils;

import java.net.URI;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 크롤 1회분의 공유 상태. 하나의 락이 visited/scheduled 집합, 발견 목록, 진행 카운터를 모두 보호한다.
 * 락은 개별 상태 갱신 동안만 잡고, 네트워크 호출 중에는 잡지 않는다.
 */
public final class CrawlState {

    private final ReentrantLock lock = new ReentrantLock();

    private final Set<String> visited = new HashSet<>();    // 꺼내서 처리한 URL
    private final Set<String> scheduled = new HashSet<>();  // 프런티어에 넣은 적 있는 URL
    private final FindingsStore findings;

    private long crawled;
    private int queued;
    private int depth;

    public CrawlState(FindingListener listener) {
        this.findings = new FindingsStore(listener == null ? FindingListener.NONE : listener);
    }

    /**
     * 큐잉 시점의 원자적 check-and-mark. 처음 보는 URL이면 표시하고 true.
     * 같은 URL이 두 번 큐에 들어가는 경합을 여기서 막는다.
     */
    public boolean markScheduled(String url) {
        lock.lock();
        try {
            return !visited.contains(url) && scheduled.add(url);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 꺼낸 항목의 방문 시작. 이미 방문했거나 깊이 초과면 false(버림).
     * 통과하면 visited 표시, crawled+1, depth 갱신, queued 갱신을 한 번에 한다.
     */
    public boolean beginVisit(FrontierEntry entry, int maxDepth, int queuedNow) {
        String key = entry.url().toString();
        lock.lock();
        try {
            queued = queuedNow;
            if (entry.depth() > maxDepth || !visited.add(key)) return false;
            crawled++;
            depth = entry.depth();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isVisited(String url) {
        lock.lock();
        try {
            return visited.contains(url);
        } finally {
            lock.unlock();
        }
    }

    public void updateQueued(int size) {
        lock.lock();
        try {
            queued = size;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 분류된 URL을 canonical key로 기록. UNKNOWN은 무시.
     * @return 새 발견이면 true(알림 1회 발생)
     */
    public boolean recordEndpoint(URI url, EndpointCategory category) {
        FindingType type = category == null ? null : category.toFindingType();
        if (url == null || type == null) return false;
        String key = UrlUtils.canonicalize(url);
        lock.lock();
        try {
            return findings.addEndpoint(type, key);
        } finally {
            lock.unlock();
        }
    }

    /** @return 새로 추가된 이름 수 */
    public int recordFunctions(Collection<String> names) {
        if (names == null || names.isEmpty()) return 0;
        int added = 0;
        lock.lock();
        try {
            for (String n : names) {
                if (n != null && !n.isEmpty() && findings.addFunction(n)) added++;
            }
        } finally {
            lock.unlock();
        }
        return added;
    }

    public ProgressSnapshot snapshot() {
        lock.lock();
        try {
            return new ProgressSnapshot(crawled, queued, depth,
                    findings.htmlCount(), findings.backendCount(), findings.functionCount());
        } finally {
            lock.unlock();
        }
    }

    /** 발견 순서 그대로의 복사본 */
    public List<String> htmlPages() {
        lock.lock();
        try { return findings.htmlPages(); } finally { lock.unlock(); }
    }

    public List<String> backendEndpoints() {
        lock.lock();
        try { return findings.backendEndpoints(); } finally { lock.unlock(); }
    }

    public List<String> functions() {
        lock.lock();
        try { return findings.functions(); } finally { lock.unlock(); }
    }

    /** 정렬된 최종 보고서 */
    public CrawlReport toReport(String target, int configuredMaxDepth) {
        lock.lock();
        try {
            return CrawlReport.of(target, configuredMaxDepth,
                    findings.htmlPages(), findings.backendEndpoints(), findings.functions());
        } finally {
            lock.unlock();
        }
    }
}
