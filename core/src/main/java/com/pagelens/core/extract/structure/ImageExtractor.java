package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.ImageRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 이미지 수집: img[src] → 파비콘 link 요소 → 기본 /favicon.ico 순서.
 * 기본 /favicon.ico는 파비콘 link 요소가 하나도 없을 때만 추가한다.
 * 해석된 src 기준 중복 제거.
 */
public final class ImageExtractor {

    /** 파비콘 후보 셀렉터(우선순위 순) */
    public static final List<String> FAVICON_SELECTORS = List.of(
            "link[rel=icon]",
            "link[rel=\"shortcut icon\"]",
            "link[rel=apple-touch-icon]",
            "link[rel=apple-touch-icon-precomposed]");

    public List<ImageRef> extract(PageContext ctx) {
        Map<String, ImageRef> bySrc = new LinkedHashMap<>();

        for (Element img : ctx.document().select("img[src]")) {
            String src = ctx.resolve(img.attr("src"));
            if (src == null) continue;
            bySrc.putIfAbsent(src, new ImageRef(src, img.attr("alt")));
        }

        boolean declaredFavicon = false;
        for (String selector : FAVICON_SELECTORS) {
            for (Element link : ctx.document().select(selector)) {
                String src = ctx.resolve(link.attr("href"));
                if (src == null) continue;
                declaredFavicon = true;
                if (bySrc.containsKey(src)) continue;
                String sizes = link.attr("sizes").trim();
                bySrc.put(src, new ImageRef(src, sizes.isEmpty() ? "Favicon" : "Favicon " + sizes));
            }
        }

        if (!declaredFavicon) {
            String defaultFavicon = defaultFavicon(ctx);
            bySrc.putIfAbsent(defaultFavicon, new ImageRef(defaultFavicon, "Favicon"));
        }

        return new ArrayList<>(bySrc.values());
    }

    static String defaultFavicon(PageContext ctx) {
        return ctx.origin() + "/favicon.ico";
    }
}
