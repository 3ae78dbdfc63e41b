package com.webscout.core.api;

import com.webscout.core.model.FetchResult;

import java.net.URI;
import java.time.Duration;

/** HTTP fetch 최소 계약: 실패도 예외 대신 FetchResult로 돌려준다. */
@FunctionalInterface
public interface IFetcher extends AutoCloseable {
    FetchResult fetch(URI url, Duration timeout);
    @Override default void close() throws Exception {}
}
