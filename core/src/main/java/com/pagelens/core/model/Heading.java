package com.pagelens.core.model;

/** 제목 후보. level은 "h1".."h6" 문자열 그대로 보관한다. */
public record Heading(String level, String text) {
    public static Heading of(int level, String text) {
        int lv = Math.max(1, Math.min(6, level));
        return new Heading("h" + lv, text == null ? "" : text);
    }
}
