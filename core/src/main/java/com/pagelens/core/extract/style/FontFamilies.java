package com.pagelens.core.extract.style;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** font-family 선언 정규화 */
public final class FontFamilies {
    private FontFamilies() {}

    static final Set<String> GENERIC = Set.of(
            "serif", "sans-serif", "monospace", "cursive", "fantasy", "inherit", "initial", "unset");

    private static final Pattern QUOTES = Pattern.compile("['\"]");
    private static final Pattern IMPORTANT = Pattern.compile("(?i)!\\s*important");

    /**
     * 선언의 첫 family 토큰. 따옴표/!important 제거.
     * 비어 있거나 일반 키워드면 null.
     */
    public static String firstFamily(String declaration) {
        if (declaration == null) return null;
        String s = IMPORTANT.matcher(QUOTES.matcher(declaration).replaceAll("")).replaceAll("").trim();
        if (s.isEmpty()) return null;
        int comma = s.indexOf(',');
        String first = (comma < 0 ? s : s.substring(0, comma)).trim();
        if (first.isEmpty() || GENERIC.contains(first.toLowerCase(Locale.ROOT))) return null;
        return first;
    }
}
