package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** rel에 font가 있거나 폰트 확장자로 끝나는 link. 이름은 파일명에서 추정 */
public final class FontFileDetector implements FontDetector {
    static final String SOURCE = "Font File";
    static final String UNKNOWN_NAME = "Custom Font";

    private static final List<String> EXTENSIONS = List.of(".woff", ".woff2", ".ttf", ".otf", ".eot", ".svg");
    private static final Pattern FILE_NAME = Pattern.compile("([^/]+)\\.(woff|woff2|ttf|otf|eot)", Pattern.CASE_INSENSITIVE);

    @Override
    public List<FontRef> detect(PageContext ctx) {
        List<FontRef> out = new ArrayList<>();
        for (Element link : ctx.document().select("link[href]")) {
            String href = link.attr("href");
            String lower = href.toLowerCase(Locale.ROOT);
            boolean fontRel = link.attr("rel").contains("font");
            if (!fontRel && EXTENSIONS.stream().noneMatch(lower::endsWith)) continue;

            String url = ctx.resolve(href);
            if (url == null) continue;

            Matcher m = FILE_NAME.matcher(href);
            String name = m.find() ? m.group(1).replaceAll("[-_]", " ") : UNKNOWN_NAME;
            out.add(new FontRef(name, SOURCE, url, "file"));
        }
        return out;
    }
}
