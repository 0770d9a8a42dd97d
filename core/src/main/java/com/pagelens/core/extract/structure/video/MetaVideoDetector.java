package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** Open Graph 비디오 → Twitter player 메타 태그. 값은 절대 URL로 해석, 실패하면 건너뜀 */
public final class MetaVideoDetector implements VideoDetector {
    private static final String[] OG_SELECTORS = {
            "meta[property=\"og:video\"]",
            "meta[property=\"og:video:url\"]",
            "meta[property=\"og:video:secure_url\"]"};
    private static final String[] TWITTER_SELECTORS = {
            "meta[name=\"twitter:player\"]",
            "meta[property=\"twitter:player\"]"};

    @Override
    public List<VideoRef> detect(PageContext ctx) {
        List<VideoRef> out = new ArrayList<>();
        Document doc = ctx.document();

        String og = ctx.resolve(firstContent(doc, OG_SELECTORS));
        if (og != null) {
            out.add(VideoPlatforms.classifyLoose(og, "embed"));
        }
        String twitter = ctx.resolve(firstContent(doc, TWITTER_SELECTORS));
        if (twitter != null) {
            out.add(VideoRef.of(twitter, "embed"));
        }
        return out;
    }

    private static String firstContent(Document doc, String... selectors) {
        for (String s : selectors) {
            Element el = doc.selectFirst(s);
            if (el != null && !el.attr("content").isBlank()) return el.attr("content").trim();
        }
        return "";
    }
}
