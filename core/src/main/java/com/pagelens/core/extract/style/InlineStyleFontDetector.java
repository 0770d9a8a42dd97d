package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** style 속성의 font-family 선언 */
public final class InlineStyleFontDetector implements FontDetector {
    static final String SOURCE = "Inline Style";
    static final Pattern FONT_FAMILY = Pattern.compile("font-family\\s*:\\s*([^;]+)", Pattern.CASE_INSENSITIVE);

    @Override
    public List<FontRef> detect(PageContext ctx) {
        List<FontRef> out = new ArrayList<>();
        for (Element el : ctx.document().select("[style*=font-family]")) {
            Matcher m = FONT_FAMILY.matcher(el.attr("style"));
            if (m.find()) out.add(FontRef.of(m.group(1), SOURCE));
        }
        return out;
    }
}
