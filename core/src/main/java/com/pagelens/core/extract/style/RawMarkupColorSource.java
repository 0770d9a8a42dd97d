package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 직렬화 마크업 전체에서 hex / rgb() 리터럴 스윕 */
public final class RawMarkupColorSource implements ColorSource {
    static final String USAGE = "Detected";

    private static final Pattern HEX = Pattern.compile("#([0-9a-f]{3}|[0-9a-f]{6})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RGB = Pattern.compile(
            "rgba?\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+(?:\\s*,\\s*[\\d.]+)?\\s*\\)", Pattern.CASE_INSENSITIVE);

    @Override
    public List<ColorSample> collect(PageContext ctx) {
        String html = ctx.markup();
        List<ColorSample> out = new ArrayList<>();
        Matcher hex = HEX.matcher(html);
        while (hex.find()) out.add(new ColorSample(hex.group(), USAGE));
        Matcher rgb = RGB.matcher(html);
        while (rgb.find()) out.add(new ColorSample(rgb.group(), USAGE));
        return out;
    }
}
