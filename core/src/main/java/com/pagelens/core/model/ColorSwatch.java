package com.pagelens.core.model;

/**
 * 팔레트 항목(최종 결과용 불변 값).
 * hex: #rrggbb 소문자, usage: 출처 라벨 콤마 결합, frequency ≥ 1
 */
public record ColorSwatch(String value, String hex, String rgb, String usage, int frequency) {}
