package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Link;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * a[href] 링크 수집.
 * - 빈 값, javascript:, mailto:, tel: 제외
 * - 표시 텍스트: 본문 → aria-label → title → href
 * - 해석된 href 기준 중복 제거(첫 항목 우선)
 */
public final class LinkExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(LinkExtractor.class);

    public List<Link> extract(PageContext ctx) {
        Map<String, Link> byHref = new LinkedHashMap<>();
        for (Element a : ctx.document().select("a[href]")) {
            String href = a.attr("href").trim();
            if (isSkipped(href)) continue;

            String resolved = ctx.resolve(href);
            if (resolved == null) {
                LOG.debug("skip unresolvable href: {}", href);
                continue;
            }
            if (byHref.containsKey(resolved)) continue;

            String text = firstNonBlank(a.text().trim(), a.attr("aria-label"), a.attr("title"), href);
            byHref.put(resolved, new Link(text, resolved, ctx.isExternal(resolved)));
        }
        return new ArrayList<>(byHref.values());
    }

    static boolean isSkipped(String href) {
        if (href.isEmpty()) return true;
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:");
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return "";
    }
}
