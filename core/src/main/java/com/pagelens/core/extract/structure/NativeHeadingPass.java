package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Heading;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** h1~h6 요소. 텍스트는 공백 정리 후 빈 값 제외 */
public final class NativeHeadingPass implements HeadingPass {
    @Override
    public List<Heading> detect(PageContext ctx) {
        List<Heading> out = new ArrayList<>();
        for (Element h : ctx.document().select("h1, h2, h3, h4, h5, h6")) {
            String text = h.text().trim();
            if (text.isEmpty()) continue;
            out.add(new Heading(h.normalName().toLowerCase(Locale.ROOT), text));
        }
        return out;
    }
}
