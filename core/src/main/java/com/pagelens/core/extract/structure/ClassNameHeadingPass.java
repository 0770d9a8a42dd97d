package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Heading;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** class 이름 키워드로 제목을 추정한다. 마지막 단계 */
public final class ClassNameHeadingPass implements HeadingPass {
    private static final Pattern H1 = Pattern.compile("h1|hero-title|page-title|main-title");
    private static final Pattern H2 = Pattern.compile("h2|section-title");
    private static final Pattern H3 = Pattern.compile("h3|block-title");

    @Override
    public List<Heading> detect(PageContext ctx) {
        List<Heading> out = new ArrayList<>();
        for (Element el : ctx.document().select("[class]")) {
            String text = el.text().trim();
            if (text.isEmpty()) continue;
            String cls = el.attr("class").toLowerCase(Locale.ROOT);

            if (H1.matcher(cls).find()) out.add(Heading.of(1, text));
            else if (H2.matcher(cls).find()) out.add(Heading.of(2, text));
            else if (H3.matcher(cls).find()) out.add(Heading.of(3, text));
        }
        return out;
    }
}
