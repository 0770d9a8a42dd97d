package com.pagelens.core.model;

import java.net.URI;

/**
 * 검증을 통과한 URL.
 * url: 정규화된 원문(예: "https://example.com"), origin: scheme://host[:port]
 */
public record NormalizedUrl(String url, URI uri, String origin) {

    public String scheme() { return uri.getScheme().toLowerCase(java.util.Locale.ROOT); }

    public String host() { return uri.getHost(); }

    @Override
    public String toString() { return url; }
}
