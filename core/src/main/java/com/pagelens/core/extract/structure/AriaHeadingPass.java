package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Heading;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** role="heading" 요소. 레벨은 aria-level(기본 2, 1..6으로 보정) */
public final class AriaHeadingPass implements HeadingPass {
    static final int DEFAULT_LEVEL = 2;

    @Override
    public List<Heading> detect(PageContext ctx) {
        List<Heading> out = new ArrayList<>();
        for (Element el : ctx.document().select("[role=heading]")) {
            out.add(Heading.of(level(el.attr("aria-level")), el.text().trim()));
        }
        return out;
    }

    private static int level(String raw) {
        if (raw == null || raw.isBlank()) return DEFAULT_LEVEL;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_LEVEL;
        }
    }
}
