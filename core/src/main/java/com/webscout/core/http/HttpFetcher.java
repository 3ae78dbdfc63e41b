package com.webscout.core.http;

import com.webscout.core.api.IFetcher;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.model.FetchResult;
import com.webscout.core.model.FetchResult.FailureKind;
import com.webscout.core.model.HttpResponseData;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 GET fetcher: 응답을 HttpResponseData로 매핑, 실패는 FailureKind로 분류 */
public class HttpFetcher implements IFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpFetcher(CrawlConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getPageTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(CrawlConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(URI url, Duration timeout) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(stripFragment(url))
                    .timeout(timeout != null ? timeout : config.getPageTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .GET()
                    .build();
        } catch (IllegalArgumentException | URISyntaxException e) {
            return FetchResult.failure(url, FailureKind.INVALID_URL, e.getMessage());
        }

        try {
            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            HttpHeaders hh = resp.headers();

            return FetchResult.success(HttpResponseData.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(hh.map())
                    .body(resp.body() == null ? "" : resp.body())
                    .contentType(hh.firstValue("Content-Type").orElse(null))
                    .responseTimeMs(elapsedMs)
                    .build());
        } catch (HttpTimeoutException e) {
            return FetchResult.failure(url, FailureKind.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return FetchResult.failure(url, FailureKind.NETWORK, describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(url, FailureKind.INTERRUPTED, "interrupted");
        } catch (IllegalArgumentException e) {
            // 리다이렉트 대상 URL 등 HttpClient 내부 검증 실패
            return FetchResult.failure(url, FailureKind.INVALID_URL, e.getMessage());
        }
    }

    /** fragment는 서버로 가지 않으므로 요청 전에 제거 */
    private static URI stripFragment(URI u) throws URISyntaxException {
        if (u.getRawFragment() == null) return u;
        String s = u.toString();
        return new URI(s.substring(0, s.indexOf('#')));
    }

    private static String describe(IOException e) {
        String m = e.getMessage();
        return e.getClass().getSimpleName() + (m == null ? "" : ": " + m);
    }
}
