package com.pagelens.core.robots;

import com.pagelens.core.util.StructuredLog;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * origin별 robots.txt 원문 캐시.
 * 추출 결과에 첨부만 하므로 파싱하지 않는다. 어떤 실패도 추출을 막지 않는다(빈 Optional).
 */
public final class RobotsRepository {
    private static final StructuredLog SLOG = StructuredLog.get(RobotsRepository.class);

    public static final Duration DEFAULT_SUCCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_FAILURE_TTL = Duration.ofMinutes(10);
    private static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;
    private final RobotsClock clock;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    private final Duration successTtl;
    private final Duration failureTtl;

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock) {
        this(fetcher, clock, DEFAULT_SUCCESS_TTL, DEFAULT_FAILURE_TTL);
    }

    /** TTL 0이면 캐시하지 않는다 */
    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock,
                            Duration successTtl, Duration failureTtl) {
        this.fetcher = Objects.requireNonNull(fetcher);
        this.clock = Objects.requireNonNull(clock);
        this.successTtl = (successTtl == null ? DEFAULT_SUCCESS_TTL : successTtl);
        this.failureTtl = (failureTtl == null ? DEFAULT_FAILURE_TTL : failureTtl);
    }

    /** host:port 키 (포트 없으면 스킴 기본포트 사용). */
    static String cacheKey(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        String host = Optional.ofNullable(pageUri.getHost()).orElse("").toLowerCase(Locale.ROOT);
        int port = pageUri.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return scheme + "://" + host + ":" + port;
    }

    /** pageUri의 origin에 있는 robots.txt 본문. 2xx + 비어있지 않은 본문일 때만 값이 있다. */
    public Optional<String> robotsTxtFor(URI pageUri) {
        String key = cacheKey(pageUri);
        long now = clock.nowMillis();
        CacheEntry e = cache.get(key);
        if (e != null && e.expiresAt > now) {
            return Optional.ofNullable(e.body);
        }

        String body = fetchBody(pageUri);
        long ttlMs = (body != null ? successTtl : failureTtl).toMillis();
        if (ttlMs > 0) {
            cache.put(key, new CacheEntry(body, now + ttlMs));
        }
        return Optional.ofNullable(body);
    }

    /** 캐시 비우기 */
    public void clear() { cache.clear(); }

    private String fetchBody(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("").toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        URI cur = robotsTxtUri(pageUri);
        if (cur == null) return null;

        for (int i = 0; i < MAX_REDIRECTS; i++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status;
            if (s == 0) {
                SLOG.debug("robots.fail", "uri", cur, "reason", r.error.orElse("network"));
                return null;
            }
            if (s >= 200 && s < 300) {
                return (r.body == null || r.body.isEmpty()) ? null : r.body;
            }
            if (isRedirect(s) && r.finalUri != null) {
                // 동일 호스트 내에서만 허용(스킴 전환 OK)
                if (!sameHost(cur, r.finalUri)) {
                    SLOG.debug("robots.fail", "uri", cur, "reason", "cross-host redirect", "to", r.finalUri);
                    return null;
                }
                cur = r.finalUri;
                continue;
            }
            SLOG.debug("robots.fail", "uri", cur, "status", s);
            return null;
        }
        SLOG.debug("robots.fail", "uri", cur, "reason", "too many redirects");
        return null;
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 307 || s == 308;
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("").toLowerCase(Locale.ROOT);
        String hb = Optional.ofNullable(b.getHost()).orElse("").toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    private static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        String scheme = Optional.ofNullable(page.getScheme()).orElse("https");
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }

    private static final class CacheEntry {
        final String body;   // null = 실패(음성 캐시)
        final long expiresAt;
        CacheEntry(String body, long exp) { this.body = body; this.expiresAt = exp; }
    }
}
