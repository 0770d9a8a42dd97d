package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** title/description/og:image/favicon, 메타 태그, 스크립트/스타일시트, 문단 텍스트 */
public final class MetadataExtractor {

    public PageMetadata extract(PageContext ctx) {
        Document doc = ctx.document();

        Element titleEl = doc.selectFirst("title");
        String title = titleEl == null ? "" : titleEl.text().trim();

        String description = firstContent(doc, "meta[name=description]", "meta[property=\"og:description\"]");

        String ogRaw = firstContent(doc, "meta[property=\"og:image\"]", "meta[name=\"twitter:image\"]");
        String ogImage = ogRaw.isEmpty() ? null : ctx.resolve(ogRaw);

        return new PageMetadata(
                title,
                description,
                ogImage,
                favicon(ctx),
                metaTags(doc),
                resolvedAttrs(ctx, "script[src]", "src"),
                resolvedAttrs(ctx, "link[rel=stylesheet]", "href"),
                doc.select("p").stream()
                        .map(p -> p.text().trim())
                        .collect(Collectors.joining(" ")));
    }

    /** 파비콘 셀렉터 중 첫 href. 없으면 {origin}/favicon.ico */
    static String favicon(PageContext ctx) {
        for (String selector : ImageExtractor.FAVICON_SELECTORS) {
            Element link = ctx.document().selectFirst(selector);
            if (link == null || link.attr("href").isBlank()) continue;
            String resolved = ctx.resolve(link.attr("href"));
            if (resolved != null) return resolved;
        }
        return ImageExtractor.defaultFavicon(ctx);
    }

    /** name 또는 property → content. 같은 키는 나중 값이 덮어쓴다 */
    static Map<String, String> metaTags(Document doc) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Element meta : doc.select("meta")) {
            String name = meta.attr("name");
            if (name.isEmpty()) name = meta.attr("property");
            String content = meta.attr("content");
            if (!name.isEmpty() && !content.isEmpty()) {
                out.put(name, content);
            }
        }
        return out;
    }

    private static List<String> resolvedAttrs(PageContext ctx, String selector, String attr) {
        List<String> out = new ArrayList<>();
        for (Element el : ctx.document().select(selector)) {
            String v = el.attr(attr);
            if (v.isBlank()) continue;
            String resolved = ctx.resolve(v);
            if (resolved != null) out.add(resolved);
        }
        return out;
    }

    private static String firstContent(Document doc, String... selectors) {
        for (String s : selectors) {
            Element el = doc.selectFirst(s);
            if (el != null && !el.attr("content").isEmpty()) return el.attr("content");
        }
        return "";
    }
}
