package com.webscout.core.util;

import java.time.Duration;

/** 테스트에서 지연을 기록/생략할 수 있도록 분리한 sleep 훅 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper NONE = d -> {};
}
