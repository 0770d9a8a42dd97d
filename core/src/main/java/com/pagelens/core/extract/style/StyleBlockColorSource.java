package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

public final class StyleBlockColorSource implements ColorSource {
    @Override
    public List<ColorSample> collect(PageContext ctx) {
        List<ColorSample> out = new ArrayList<>();
        for (Element style : ctx.document().select("style")) {
            ColorDeclarations.scanBlock(style.data(), out);
        }
        return out;
    }
}
