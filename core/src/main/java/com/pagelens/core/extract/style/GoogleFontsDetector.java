package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;
import org.jsoup.nodes.Element;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Google Fonts 스타일시트 링크. family= 파라미터마다(css2 API는 여러 개)
 * URL 디코딩 후 '|'로 나누고 ':' 뒤 굵기/스타일 변형은 버린다.
 */
public final class GoogleFontsDetector implements FontDetector {
    static final String SOURCE = "Google Fonts";
    private static final Pattern FAMILY = Pattern.compile("[?&]family=([^&]+)");

    @Override
    public List<FontRef> detect(PageContext ctx) {
        List<FontRef> out = new ArrayList<>();
        for (Element link : ctx.document().select("link[href*=fonts.googleapis.com], link[href*=fonts.gstatic.com]")) {
            String href = link.attr("href");
            if (!href.contains("fonts.googleapis.com")) continue;

            String url = ctx.resolve(href);
            Matcher m = FAMILY.matcher(href);
            while (m.find()) {
                for (String family : decode(m.group(1)).split("\\|")) {
                    int colon = family.indexOf(':');
                    String name = (colon < 0 ? family : family.substring(0, colon)).trim();
                    if (!name.isEmpty()) {
                        out.add(new FontRef(name, SOURCE, url != null ? url : href, "google"));
                    }
                }
            }
        }
        return out;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s; // 잘못된 %-인코딩은 원문 사용
        }
    }
}
