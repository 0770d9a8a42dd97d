package com.pagelens.core.extract.style;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS 색 값 → 정규 #rrggbb(소문자).
 * 변환 불가(transparent, 키워드, 잘못된 길이 등)면 null.
 */
public final class CssColors {
    private CssColors() {}

    static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("black", "#000000"), Map.entry("white", "#ffffff"),
            Map.entry("red", "#ff0000"), Map.entry("green", "#008000"),
            Map.entry("blue", "#0000ff"), Map.entry("yellow", "#ffff00"),
            Map.entry("cyan", "#00ffff"), Map.entry("magenta", "#ff00ff"),
            Map.entry("silver", "#c0c0c0"), Map.entry("gray", "#808080"),
            Map.entry("maroon", "#800000"), Map.entry("olive", "#808000"),
            Map.entry("lime", "#00ff00"), Map.entry("aqua", "#00ffff"),
            Map.entry("teal", "#008080"), Map.entry("navy", "#000080"),
            Map.entry("fuchsia", "#ff00ff"), Map.entry("purple", "#800080"),
            Map.entry("orange", "#ffa500"), Map.entry("pink", "#ffc0cb"));

    private static final Pattern HEX = Pattern.compile("#([0-9a-f]{3}|[0-9a-f]{6})");
    private static final Pattern RGB = Pattern.compile(
            "rgba?\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*(?:,\\s*[\\d.]+\\s*)?\\)");
    private static final Pattern IMPORTANT = Pattern.compile("(?i)!\\s*important");

    /** 단일 색 토큰 변환 */
    public static String toHex(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) return null;

        if (v.startsWith("#")) {
            if (!HEX.matcher(v).matches()) return null;
            if (v.length() == 4) {
                return "#" + v.charAt(1) + v.charAt(1) + v.charAt(2) + v.charAt(2) + v.charAt(3) + v.charAt(3);
            }
            return v;
        }

        Matcher m = RGB.matcher(v);
        if (m.matches()) {
            return "#" + channel(m.group(1)) + channel(m.group(2)) + channel(m.group(3));
        }
        return NAMED.get(v);
    }

    /** #rrggbb → "rgb(r, g, b)" */
    public static String toRgb(String hex) {
        int r = Integer.parseInt(hex.substring(1, 3), 16);
        int g = Integer.parseInt(hex.substring(3, 5), 16);
        int b = Integer.parseInt(hex.substring(5, 7), 16);
        return "rgb(" + r + ", " + g + ", " + b + ")";
    }

    /**
     * 선언 값(예: "1px solid #ccc !important")에서 변환되는 첫 토큰.
     * 괄호 안 공백(rgb(1, 2, 3))은 토큰 구분자로 보지 않는다. 없으면 null.
     */
    public static String firstColorToken(String declaration) {
        if (declaration == null) return null;
        String v = IMPORTANT.matcher(declaration).replaceAll("").trim();
        if (v.isEmpty()) return null;
        for (String token : splitTopLevel(v)) {
            if (toHex(token) != null) return token;
        }
        return null;
    }

    static List<String> splitTopLevel(String s) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && depth > 0) depth--;

            if (Character.isWhitespace(c) && depth == 0) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }

    private static String channel(String digits) {
        int n;
        try {
            n = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            n = 255; // int 범위 초과 자릿수
        }
        n = Math.max(0, Math.min(255, n));
        return String.format("%02x", n);
    }
}
