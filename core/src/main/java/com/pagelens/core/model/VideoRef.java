package com.pagelens.core.model;

import java.util.Optional;

/**
 * 비디오 후보.
 * type: video | embed | object | direct | source 요소의 MIME 타입
 * platform/thumbnail은 알려진 호스트에서만 채워지며 없으면 null.
 */
public record VideoRef(String src, String type, String platform, String thumbnail) {

    public static VideoRef of(String src, String type) {
        return new VideoRef(src, type, null, null);
    }

    public Optional<String> platformOpt() { return Optional.ofNullable(platform); }
    public Optional<String> thumbnailOpt() { return Optional.ofNullable(thumbnail); }
}
