package com.pagelens.core.http;

import com.pagelens.core.api.ExtractionException;
import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.model.ExtractorConfig;
import com.pagelens.core.model.FetchedPage;
import com.pagelens.core.util.DefaultSleeper;
import com.pagelens.core.util.Sleeper;
import com.pagelens.core.util.UrlResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDK HttpClient 기반 페이지 수집기.
 * - 429/5xx/네트워크 오류에서만 RetryPolicy에 따라 재시도(Retry-After 우선, 상한 30s)
 * - 리다이렉트는 직접 따라가며 매 홉마다 UrlResolver.normalize로 재검증
 * - 예외를 던지지 않는다. 네트워크 오류는 statusCode -1, 리다이렉트 차단은 0 (+ error)
 */
public class HttpPageFetcher implements IPageFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final int MAX_REDIRECTS = 5;
    private static final long RETRY_AFTER_CAP_SEC = 30;
    /** 리다이렉트 차단/초과. 재시도 대상 아님 */
    static final int BLOCKED = 0;

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final ExtractorConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public HttpPageFetcher(ExtractorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)   // 홉마다 검증하려고 직접 처리
                .connectTimeout(config.getPageTimeout())
                .build();
        this.sender = null;
        this.retryPolicy = new DefaultRetryPolicy(config.getFetchAttempts(), 500);
        this.sleeper = new DefaultSleeper();
    }

    /** 테스트용 생성자(송신 훅/정책/슬리퍼 주입) */
    public HttpPageFetcher(ExtractorConfig config, HttpSender testSender, RetryPolicy policy, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.retryPolicy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public FetchedPage fetch(URI url) {
        Objects.requireNonNull(url, "url");
        int attempt = 1;
        while (true) {
            FetchedPage page = fetchFollowingRedirects(url);
            int status = page.getStatusCode();
            if (!retryPolicy.shouldRetry(status, attempt)) {
                return page;
            }
            Duration delay = resolveRetryAfterOr(retryPolicy.nextDelay(attempt), page);
            LOG.debug("retrying {} after status {} (attempt {}, wait {}ms)", url, status, attempt, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return page;
            }
            attempt++;
            if (attempt > retryPolicy.maxAttempts()) {
                return page;
            }
        }
    }

    private FetchedPage fetchFollowingRedirects(URI start) {
        URI cur = start;
        for (int hop = 0; ; hop++) {
            FetchedPage page = send(cur);
            if (!config.isFollowRedirects() || !isRedirect(page.getStatusCode())) {
                return page;
            }
            String location = page.header("Location");
            if (location == null || location.isBlank()) {
                return page;
            }
            if (hop >= MAX_REDIRECTS) {
                return failure(cur, BLOCKED, 0, "too many redirects");
            }
            URI next;
            try {
                next = UrlResolver.normalize(cur.resolve(location.trim()).toString()).uri();
            } catch (ExtractionException | IllegalArgumentException e) {
                LOG.warn("redirect blocked {} -> {}: {}", cur, location, e.getMessage());
                return failure(cur, BLOCKED, 0, "redirect blocked: " + e.getMessage());
            }
            cur = next;
        }
    }

    private FetchedPage send(URI url) {
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(config.getPageTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            HttpHeaders hh = resp.headers();
            Map<String, List<String>> headers = hh.map();
            return FetchedPage.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(headers)
                    .body(resp.body() == null ? "" : resp.body())
                    .contentType(hh.firstValue("Content-Type").orElse(null))
                    .responseTimeMs(elapsedMs(start))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(url, -1, elapsedMs(start), "interrupted");
        } catch (Exception e) {
            LOG.debug("fetch failed {}: {}", url, e.toString());
            return failure(url, -1, elapsedMs(start), e.toString());
        }
    }

    private static FetchedPage failure(URI url, int status, long elapsedMs, String error) {
        return FetchedPage.builder()
                .url(url)
                .statusCode(status)
                .headers(Map.of())
                .body("")
                .responseTimeMs(elapsedMs)
                .error(error)
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 303 || s == 307 || s == 308;
    }

    /** Retry-After(초 단위)를 존중하되 30초로 상한. HTTP-date 형태는 fallback */
    private static Duration resolveRetryAfterOr(Duration fallback, FetchedPage page) {
        String v = page.header("Retry-After");
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            return Duration.ofSeconds(Math.max(0, Math.min(sec, RETRY_AFTER_CAP_SEC)));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
