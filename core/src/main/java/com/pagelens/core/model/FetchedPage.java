package com.pagelens.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** 페이지 수집 결과(본문은 텍스트 기준). statusCode -1 = 네트워크 오류 */
public final class FetchedPage {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final String error;

    private FetchedPage(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    /** 네트워크 수준 실패(응답 자체가 없음) */
    public boolean isNetworkFailure() { return statusCode < 0; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private String error;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(url, "url");
            return new FetchedPage(this);
        }
    }
}
