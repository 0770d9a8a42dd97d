package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** embed[src] / object[data] 중 비디오 파일로 보이는 것 */
public final class EmbedObjectVideoDetector implements VideoDetector {

    @Override
    public List<VideoRef> detect(PageContext ctx) {
        List<VideoRef> out = new ArrayList<>();
        for (Element embed : ctx.document().select("embed[src]")) {
            String raw = embed.attr("src");
            if (isVideoFile(raw) || raw.contains("video")) {
                add(ctx, out, raw, "embed");
            }
        }
        for (Element obj : ctx.document().select("object[data]")) {
            String raw = obj.attr("data");
            if (isVideoFile(raw)) {
                add(ctx, out, raw, "object");
            }
        }
        return out;
    }

    private static boolean isVideoFile(String s) {
        return s.contains(".mp4") || s.contains(".webm") || s.contains(".ogg");
    }

    private static void add(PageContext ctx, List<VideoRef> out, String raw, String type) {
        String src = ctx.resolve(raw);
        if (src != null) out.add(VideoRef.of(src, type));
    }
}
