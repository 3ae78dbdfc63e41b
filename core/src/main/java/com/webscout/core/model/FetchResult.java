package com.webscout.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 단일 fetch 결과: 성공이면 응답, 실패면 원인 종류와 메시지.
 * 실패를 예외 대신 값으로 돌려주고, 건너뛸지 여부는 호출자(Crawler)가 결정한다.
 */
public final class FetchResult {

    /** 실패 분류 */
    public enum FailureKind {
        /** 요청 타임아웃 */
        TIMEOUT,
        /** 연결 거부/리셋/DNS 등 I/O 오류 */
        NETWORK,
        /** HttpClient가 받아들이지 않는 URL */
        INVALID_URL,
        /** 취소(인터럽트) */
        INTERRUPTED
    }

    private final URI url;
    private final HttpResponseData response;
    private final FailureKind failure;
    private final String message;

    private FetchResult(URI url, HttpResponseData response, FailureKind failure, String message) {
        this.url = url;
        this.response = response;
        this.failure = failure;
        this.message = message;
    }

    public static FetchResult success(HttpResponseData response) {
        Objects.requireNonNull(response, "response");
        return new FetchResult(response.getUrl(), response, null, null);
    }

    public static FetchResult failure(URI url, FailureKind kind, String message) {
        return new FetchResult(url, null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isSuccess() { return response != null; }
    public URI getUrl() { return url; }

    /** 성공 응답. 실패 결과에서 호출하면 IllegalStateException */
    public HttpResponseData getResponse() {
        if (response == null) throw new IllegalStateException("fetch failed: " + failure + " " + url);
        return response;
    }

    /** 본문 텍스트(실패 시 빈 문자열) */
    public String body() { return response == null ? "" : response.getBody(); }

    public FailureKind getFailure() { return failure; }
    public String getMessage() { return message; }

    @Override public String toString() {
        return isSuccess()
                ? "FetchResult{ok " + response.getStatusCode() + " " + url + "}"
                : "FetchResult{" + failure + " " + url + ": " + message + "}";
    }
}
