package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** 비디오 파일로 직접 연결되는 앵커 (type=direct) */
public final class LinkedVideoDetector implements VideoDetector {
    static final List<String> EXTENSIONS =
            List.of(".mp4", ".webm", ".ogg", ".mov", ".avi", ".wmv", ".flv", ".mkv");

    @Override
    public List<VideoRef> detect(PageContext ctx) {
        List<VideoRef> out = new ArrayList<>();
        for (Element a : ctx.document().select("a[href]")) {
            String href = a.attr("href");
            String lower = href.toLowerCase(Locale.ROOT);
            if (EXTENSIONS.stream().noneMatch(lower::endsWith)) continue;
            String src = ctx.resolve(href);
            if (src != null) out.add(VideoRef.of(src, "direct"));
        }
        return out;
    }
}
