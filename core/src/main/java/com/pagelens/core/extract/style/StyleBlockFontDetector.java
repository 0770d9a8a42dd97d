package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** style 블록: @font-face 선언 먼저, 그다음 일반 font-family 규칙 */
public final class StyleBlockFontDetector implements FontDetector {
    static final String FONT_FACE_SOURCE = "CSS @font-face";
    static final String RULE_SOURCE = "CSS Style";

    private static final Pattern FONT_FACE = Pattern.compile(
            "@font-face\\s*\\{[^}]*font-family\\s*:\\s*['\"]?([^'\";}]+)['\"]?[^}]*}", Pattern.CASE_INSENSITIVE);

    @Override
    public List<FontRef> detect(PageContext ctx) {
        List<FontRef> out = new ArrayList<>();
        for (Element style : ctx.document().select("style")) {
            String css = style.data();

            Matcher face = FONT_FACE.matcher(css);
            while (face.find()) out.add(FontRef.of(face.group(1), FONT_FACE_SOURCE));

            Matcher rule = InlineStyleFontDetector.FONT_FAMILY.matcher(css);
            while (rule.find()) out.add(FontRef.of(rule.group(1), RULE_SOURCE));
        }
        return out;
    }
}
