package com.pagelens.core.robots;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/** JDK HttpClient 기반 기본 구현. 요청 단위 타임아웃을 건다. */
public final class HttpRobotsFetcher implements RobotsFetcher {
    private static final String DEFAULT_UA = "PageLens";

    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpRobotsFetcher(Duration timeout, String userAgent) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(timeout)
                        .build(),
                timeout, userAgent);
    }

    public HttpRobotsFetcher(HttpClient client, Duration timeout, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_UA : userAgent;
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        try {
            HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .build();

            // Redirect.NEVER → repository가 직접 리다이렉트 판단
            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();

            if (code == 301 || code == 302 || code == 307 || code == 308) {
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(robotsTxtUri);
                return new Response(code, "", next, null);
            }

            String body = res.body() == null ? "" : res.body();
            return Response.ok(code, body, robotsTxtUri);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", robotsTxtUri);
        } catch (Exception e) {
            return Response.fail(e.toString(), robotsTxtUri);
        }
    }
}
