package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * video 요소: 자체 src(지연 로딩 별칭 포함) 먼저, 그다음 하위 source 요소.
 * poster는 썸네일로 사용.
 */
public final class HtmlVideoDetector implements VideoDetector {
    static final String[] SRC_ATTRS = {"src", "data-src", "data-lazy-src", "data-original"};
    static final String[] POSTER_ATTRS = {"poster", "data-poster", "data-lazy-poster"};

    @Override
    public List<VideoRef> detect(PageContext ctx) {
        List<VideoRef> out = new ArrayList<>();
        var videos = ctx.document().select("video");

        for (Element v : videos) {
            String src = ctx.resolve(firstAttr(v, SRC_ATTRS));
            if (src != null) {
                out.add(new VideoRef(src, "video", null, poster(ctx, v)));
            }
        }

        for (Element v : videos) {
            String thumb = poster(ctx, v);
            for (Element source : v.select("source")) {
                String src = ctx.resolve(firstAttr(source, SRC_ATTRS));
                if (src == null) continue;
                String type = source.attr("type").isBlank() ? "video" : source.attr("type").trim();
                out.add(new VideoRef(src, type, null, thumb));
            }
        }
        return out;
    }

    private static String poster(PageContext ctx, Element v) {
        String raw = firstAttr(v, POSTER_ATTRS);
        return raw.isEmpty() ? null : ctx.resolve(raw);
    }

    /** 값이 있는 첫 속성(trim). 없으면 "" */
    static String firstAttr(Element el, String... names) {
        for (String n : names) {
            String v = el.attr(n).trim();
            if (!v.isEmpty()) return v;
        }
        return "";
    }
}
