package com.webscout.core.crawler;

import com.webscout.core.model.ProgressSnapshot;
import com.webscout.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 스냅샷을 주기적으로 읽어 ProgressListener에 넘기는 취소 가능한 백그라운드 작업.
 * - 크롤 흐름과 분리: 스냅샷 Supplier만 알고 상태는 건드리지 않는다
 * - stop()은 스레드 종료까지 기다린다(고아 작업 없음)
 */
public final class ProgressReporter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressReporter.class);

    private final Supplier<ProgressSnapshot> snapshotSupplier;
    private final ProgressListener listener;
    private final long periodMs;

    private final ScheduledExecutorService ses;
    private final Object lock = new Object();
    private ScheduledFuture<?> future;
    private volatile boolean started = false;
    private volatile boolean closed  = false;

    public ProgressReporter(Supplier<ProgressSnapshot> snapshotSupplier,
                            ProgressListener listener,
                            Duration interval) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
        this.periodMs = Math.max(1L, Objects.requireNonNull(interval, "interval").toMillis());
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crawl-progress");
            t.setDaemon(true);
            return t;
        });
    }

    /** 주기적 폴링 시작(중복 호출 안전) */
    public void start() {
        synchronized (lock) {
            if (started || closed) return;
            future = ses.scheduleAtFixedRate(this::tick, 0L, periodMs, TimeUnit.MILLISECONDS);
            started = true;
        }
    }

    public boolean isRunning() {
        return started && !closed;
    }

    private void tick() {
        if (closed) return;
        try {
            listener.onProgress(snapshotSupplier.get());
        } catch (RuntimeException e) {
            // 예외가 새면 scheduleAtFixedRate가 조용히 멈추므로 여기서 끊는다
            LOG.warn("Progress listener failed: {}", e.toString());
        }
    }

    /** 중지 + 스레드 종료 대기 후 마지막 스냅샷 1회 전달 */
    public void stop() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            if (future != null) {
                future.cancel(false);
                future = null;
            }
            ses.shutdown();
        }
        try {
            if (!ses.awaitTermination(periodMs * 2 + 1_000L, TimeUnit.MILLISECONDS)) {
                ses.shutdownNow();
                LOG.warn("Progress reporter did not stop in time");
            }
        } catch (InterruptedException ie) {
            ses.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (started) {
            try {
                listener.onFinished(snapshotSupplier.get());
            } catch (RuntimeException e) {
                LOG.warn("Progress listener failed on finish: {}", e.toString());
            }
        }
    }

    /** 종료 여부(스레드까지 끝났는지) */
    public boolean isTerminated() {
        return ses.isTerminated();
    }

    @Override
    public void close() { stop(); }
}
