package com.pagelens.core.model;

import java.time.Duration;
import java.util.Locale;

/**
 * 추출기 설정(pagelens.yml 매핑 대상). 순수 설정 보관용.
 * 코어 추출 알고리즘은 입력 문서만으로 결정적이며, 여기 값은 주변부(robots/fetch/팔레트 상한)만 조정한다.
 */
public final class ExtractorConfig {

    /** 팔레트 최대 크기(불변식 상한) */
    public static final int MAX_COLORS_LIMIT = 50;

    /** robots.txt 관련 하위 설정: YAML의 `robots:` 섹션과 매핑 */
    public static final class RobotsCfg {
        /** robots.txt 가져오기 여부 (기본 true, 실패해도 추출은 계속) */
        private boolean fetch = true;
        /** 요청 타임아웃(ms). 기본 5000 */
        private int timeoutMs = 5000;
        /** origin별 캐시 TTL(분). 0이면 캐시 미사용 */
        private int cacheTtlMinutes = 30;

        public boolean isFetch() { return fetch; }
        public RobotsCfg setFetch(boolean fetch) { this.fetch = fetch; return this; }

        public int getTimeoutMs() { return timeoutMs; }
        public RobotsCfg setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; return this; }

        public int getCacheTtlMinutes() { return cacheTtlMinutes; }
        public RobotsCfg setCacheTtlMinutes(int v) { this.cacheTtlMinutes = v; return this; }

        public Duration timeout() { return Duration.ofMillis(Math.max(1, timeoutMs)); }
    }

    // ---------- 기본 필드 ----------
    private String userAgent = "PageLens/0.1 (+extractor)";
    private Duration pageTimeout = Duration.ofSeconds(15);
    private boolean followRedirects = true;
    private int fetchAttempts = 2;               // 첫 시도 포함
    private int maxColors = MAX_COLORS_LIMIT;
    private String phoneDefaultRegion;           // null이면 국제번호(+)만 인식
    private RobotsCfg robots = new RobotsCfg();

    // ---------- getters ----------
    public String getUserAgent() { return userAgent; }
    public Duration getPageTimeout() { return pageTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getFetchAttempts() { return fetchAttempts; }
    public int getMaxColors() { return maxColors; }
    public String getPhoneDefaultRegion() { return phoneDefaultRegion; }
    public RobotsCfg getRobots() { return robots; }

    // ---------- fluent setters ----------
    public ExtractorConfig setUserAgent(String ua) {
        if (ua != null && !ua.isBlank()) this.userAgent = ua.trim();
        return this;
    }
    public ExtractorConfig setPageTimeout(Duration timeout) { this.pageTimeout = timeout; return this; }
    public ExtractorConfig setPageTimeoutMs(long ms) {
        this.pageTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
    public ExtractorConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ExtractorConfig setFetchAttempts(int v) { this.fetchAttempts = v; return this; }

    /** 1..50 범위로 보정 */
    public ExtractorConfig setMaxColors(int v) {
        this.maxColors = Math.max(1, Math.min(MAX_COLORS_LIMIT, v));
        return this;
    }

    /** ISO 3166 alpha-2 (예: "US", "KR"). 빈 값이면 해제 */
    public ExtractorConfig setPhoneDefaultRegion(String region) {
        this.phoneDefaultRegion = (region == null || region.isBlank())
                ? null : region.trim().toUpperCase(Locale.ROOT);
        return this;
    }
    public ExtractorConfig setRobots(RobotsCfg robots) { this.robots = (robots != null ? robots : new RobotsCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (pageTimeout == null || pageTimeout.isNegative() || pageTimeout.isZero())
            throw new IllegalArgumentException("pageTimeout must be > 0");
        if (fetchAttempts < 1) throw new IllegalArgumentException("fetchAttempts must be >= 1");
        if (maxColors < 1 || maxColors > MAX_COLORS_LIMIT)
            throw new IllegalArgumentException("maxColors must be within 1.." + MAX_COLORS_LIMIT);
        if (phoneDefaultRegion != null && !phoneDefaultRegion.matches("[A-Z]{2}"))
            throw new IllegalArgumentException("phoneDefaultRegion must be a 2-letter region code");

        if (robots == null) robots = new RobotsCfg();
        if (robots.getTimeoutMs() <= 0)
            throw new IllegalArgumentException("robots.timeoutMs must be > 0");
        if (robots.getCacheTtlMinutes() < 0)
            throw new IllegalArgumentException("robots.cacheTtlMinutes must be >= 0");
    }

    // ---------- helpers ----------
    public static ExtractorConfig defaults() { return new ExtractorConfig(); }

    public long getPageTimeoutMs() { return pageTimeout.toMillis(); }
}
