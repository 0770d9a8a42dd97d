package com.pagelens.core.http;

import com.pagelens.core.model.ExtractorConfig;
import com.pagelens.core.model.FetchedPage;
import com.pagelens.core.util.Sleeper;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

class HttpPageFetcherTest {

    /** 테스트용 Sleeper: sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String,List<String>> headers; final String body;
        Resp(int code, Map<String,List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a,b)->true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://example.com"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    /** 지터 없는 고정 정책 */
    static RetryPolicy fixed(int max, long delayMs) {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int status, int attempt) {
                return (status == 429 || status == -1 || status >= 500) && attempt < max;
            }
            @Override public Duration nextDelay(int attempt) { return Duration.ofMillis(delayMs); }
            @Override public int maxAttempts() { return max; }
        };
    }

    private static final URI START = URI.create("https://example.com/");

    @Test
    void retryAfter_is_honored_on_429_and_succeeds_on_second_attempt() {
        AtomicInteger calls = new AtomicInteger(0);
        HttpPageFetcher.HttpSender sender = req -> {
            if (calls.incrementAndGet() == 1) {
                return new Resp(429, Map.of("Retry-After", List.of("1")), "slow down");
            }
            return new Resp(200, Map.of("Content-Type", List.of("text/html")), "<html>ok</html>");
        };
        TestSleeper sleeper = new TestSleeper();
        HttpPageFetcher fetcher = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(3, 250), sleeper);

        FetchedPage page = fetcher.fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(200);
        Assertions.assertThat(page.getBody()).isEqualTo("<html>ok</html>");
        Assertions.assertThat(page.getContentType()).isEqualTo("text/html");
        Assertions.assertThat(calls.get()).isEqualTo(2);
        Assertions.assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void retryAfter_is_capped_at_30_seconds() {
        AtomicInteger calls = new AtomicInteger(0);
        HttpPageFetcher.HttpSender sender = req -> calls.incrementAndGet() == 1
                ? new Resp(503, Map.of("Retry-After", List.of("3600")), "")
                : new Resp(200, Map.of(), "ok");
        TestSleeper sleeper = new TestSleeper();

        new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(2, 250), sleeper).fetch(START);

        Assertions.assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(30));
    }

    @Test
    void gives_up_after_max_attempts_and_returns_last_response() {
        AtomicInteger calls = new AtomicInteger(0);
        HttpPageFetcher.HttpSender sender = req -> {
            calls.incrementAndGet();
            return new Resp(502, Map.of(), "bad gateway");
        };
        TestSleeper sleeper = new TestSleeper();

        FetchedPage page = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(3, 100), sleeper).fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(502);
        Assertions.assertThat(calls.get()).isEqualTo(3);
        Assertions.assertThat(sleeper.sleeps).hasSize(2).allMatch(d -> d.toMillis() == 100);
    }

    @Test
    void sender_exception_becomes_minus1_with_error() {
        HttpPageFetcher.HttpSender sender = req -> { throw new IOException("connection reset"); };

        FetchedPage page = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(1, 0), new TestSleeper())
                .fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(-1);
        Assertions.assertThat(page.isNetworkFailure()).isTrue();
        Assertions.assertThat(page.getError()).hasValueSatisfying(e -> Assertions.assertThat(e).contains("connection reset"));
    }

    @Test
    void client_errors_are_not_retried() {
        AtomicInteger calls = new AtomicInteger(0);
        HttpPageFetcher.HttpSender sender = req -> {
            calls.incrementAndGet();
            return new Resp(404, Map.of(), "nope");
        };

        FetchedPage page = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(3, 100), new TestSleeper())
                .fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(404);
        Assertions.assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void same_site_redirect_is_followed() {
        List<URI> seen = new ArrayList<>();
        HttpPageFetcher.HttpSender sender = req -> {
            seen.add(req.uri());
            if (req.uri().getPath().equals("/")) {
                return new Resp(301, Map.of("Location", List.of("/home")), "");
            }
            return new Resp(200, Map.of(), "home");
        };

        FetchedPage page = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(1, 0), new TestSleeper())
                .fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(200);
        Assertions.assertThat(page.getUrl()).isEqualTo(URI.create("https://example.com/home"));
        Assertions.assertThat(seen).containsExactly(START, URI.create("https://example.com/home"));
    }

    @Test
    void redirect_to_private_address_is_blocked_and_not_retried() {
        List<URI> seen = new ArrayList<>();
        HttpPageFetcher.HttpSender sender = req -> {
            seen.add(req.uri());
            return new Resp(302, Map.of("Location", List.of("http://127.0.0.1:8080/admin")), "");
        };
        TestSleeper sleeper = new TestSleeper();

        FetchedPage page = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(3, 100), sleeper).fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(HttpPageFetcher.BLOCKED);
        Assertions.assertThat(page.getError()).hasValueSatisfying(e -> Assertions.assertThat(e).startsWith("redirect blocked"));
        Assertions.assertThat(seen).containsExactly(START);
        Assertions.assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void redirect_loop_stops_after_limit() {
        AtomicInteger calls = new AtomicInteger(0);
        HttpPageFetcher.HttpSender sender = req -> {
            int n = calls.incrementAndGet();
            return new Resp(302, Map.of("Location", List.of("/r" + n)), "");
        };

        FetchedPage page = new HttpPageFetcher(ExtractorConfig.defaults(), sender, fixed(1, 0), new TestSleeper())
                .fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(HttpPageFetcher.BLOCKED);
        Assertions.assertThat(page.getError()).contains("too many redirects");
        Assertions.assertThat(calls.get()).isEqualTo(6);
    }

    @Test
    void redirects_are_returned_as_is_when_following_is_disabled() {
        HttpPageFetcher.HttpSender sender = req -> new Resp(301, Map.of("Location", List.of("/home")), "");
        ExtractorConfig cfg = ExtractorConfig.defaults().setFollowRedirects(false);

        FetchedPage page = new HttpPageFetcher(cfg, sender, fixed(1, 0), new TestSleeper()).fetch(START);

        Assertions.assertThat(page.getStatusCode()).isEqualTo(301);
        Assertions.assertThat(page.header("location")).isEqualTo("/home");
    }
}
