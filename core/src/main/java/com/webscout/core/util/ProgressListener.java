package com.webscout.core.util;

import com.webscout.core.model.ProgressSnapshot;

/** ProgressReporter가 주기적으로 호출. 구현은 가볍고 논블로킹이어야 한다. */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ProgressSnapshot snapshot);

    /** 폴링 종료 직전 1회(마지막 스냅샷) */
    default void onFinished(ProgressSnapshot last) {}

    ProgressListener NONE = s -> {};
}
