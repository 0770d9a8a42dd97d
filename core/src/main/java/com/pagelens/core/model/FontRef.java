package com.pagelens.core.model;

/**
 * 폰트 항목.
 * name: 첫 번째 family 토큰, source: 출처 라벨(Google Fonts, Inline Style ...)
 * url/type은 링크 기반 출처에서만 채워진다.
 */
public record FontRef(String name, String source, String url, String type) {
    public static FontRef of(String name, String source) {
        return new FontRef(name, source, null, null);
    }
}
