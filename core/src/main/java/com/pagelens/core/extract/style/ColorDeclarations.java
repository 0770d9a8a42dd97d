package com.pagelens.core.extract.style;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** background / color / border 선언 스캐너. 인라인은 속성당 첫 선언, 스타일 블록은 전부 */
final class ColorDeclarations {
    private ColorDeclarations() {}

    static final String BACKGROUND = "Background";
    static final String TEXT = "Text";
    static final String BORDER = "Border";

    // 인라인: ';' 까지, 블록: ';' '{' '}' 까지
    private static final String INLINE_VALUE = "([^;]+)";
    private static final String BLOCK_VALUE = "([^;{}]+)";

    private static final Pattern INLINE_BG = bg(INLINE_VALUE);
    private static final Pattern INLINE_COLOR = color(INLINE_VALUE);
    private static final Pattern INLINE_BORDER = border(INLINE_VALUE);
    private static final Pattern BLOCK_BG = bg(BLOCK_VALUE);
    private static final Pattern BLOCK_COLOR = color(BLOCK_VALUE);
    private static final Pattern BLOCK_BORDER = border(BLOCK_VALUE);

    static void scanInline(String style, List<ColorSample> out) {
        first(INLINE_BG, style, BACKGROUND, out);
        first(INLINE_COLOR, style, TEXT, out);
        first(INLINE_BORDER, style, BORDER, out);
    }

    static void scanBlock(String css, List<ColorSample> out) {
        all(BLOCK_BG, css, BACKGROUND, out);
        all(BLOCK_COLOR, css, TEXT, out);
        all(BLOCK_BORDER, css, BORDER, out);
    }

    private static void first(Pattern p, String css, String usage, List<ColorSample> out) {
        Matcher m = p.matcher(css);
        if (m.find()) add(m.group(1), usage, out);
    }

    private static void all(Pattern p, String css, String usage, List<ColorSample> out) {
        Matcher m = p.matcher(css);
        while (m.find()) add(m.group(1), usage, out);
    }

    private static void add(String declaration, String usage, List<ColorSample> out) {
        String token = CssColors.firstColorToken(declaration);
        if (token != null) out.add(new ColorSample(token, usage));
    }

    private static Pattern bg(String value) {
        return Pattern.compile("background(?:-color)?\\s*:\\s*" + value, Pattern.CASE_INSENSITIVE);
    }

    // border-color, background-color 안의 "color"는 Text로 세지 않는다
    private static Pattern color(String value) {
        return Pattern.compile("(?<![\\w-])color\\s*:\\s*" + value, Pattern.CASE_INSENSITIVE);
    }

    private static Pattern border(String value) {
        return Pattern.compile("border(?:-color)?\\s*:\\s*" + value, Pattern.CASE_INSENSITIVE);
    }
}
