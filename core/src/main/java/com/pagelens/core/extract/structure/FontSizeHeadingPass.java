package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Heading;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 인라인 font-size로 제목을 추정한다(모든 요소 대상).
 * 정확한 임계값이 아닌 패턴 매칭: 30~59px → h1, 20~39px → h2, 18~20px → h3 (앞선 규칙 우선)
 */
public final class FontSizeHeadingPass implements HeadingPass {
    static final int MIN_TEXT_LENGTH = 4;

    private static final Pattern H1 = Pattern.compile("font-size:\\s*(3|4|5)\\dpx");
    private static final Pattern H2 = Pattern.compile("font-size:\\s*(2|3)\\dpx");
    private static final Pattern H3 = Pattern.compile("font-size:\\s*(18|19|20)px");

    @Override
    public List<Heading> detect(PageContext ctx) {
        List<Heading> out = new ArrayList<>();
        for (Element el : ctx.document().getAllElements()) {
            String style = el.attr("style").toLowerCase(Locale.ROOT);
            if (!style.contains("font-size")) continue;
            String text = el.text().trim();
            if (text.length() < MIN_TEXT_LENGTH) continue;

            if (H1.matcher(style).find()) out.add(Heading.of(1, text));
            else if (H2.matcher(style).find()) out.add(Heading.of(2, text));
            else if (H3.matcher(style).find()) out.add(Heading.of(3, text));
        }
        return out;
    }
}
