package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * iframe 임베드. 알려진 플랫폼(YouTube/Vimeo/Dailymotion)이거나
 * src에 비디오 관련 키워드가 있을 때만 후보로 본다. type은 항상 embed.
 */
public final class IframeVideoDetector implements VideoDetector {
    private static final String[] VIDEO_HINTS = {"video", "player", "embed", "youtube", "vimeo", "dailymotion"};

    @Override
    public List<VideoRef> detect(PageContext ctx) {
        List<VideoRef> out = new ArrayList<>();
        for (Element frame : ctx.document().select("iframe")) {
            String raw = HtmlVideoDetector.firstAttr(frame, HtmlVideoDetector.SRC_ATTRS);
            if (raw.isEmpty()) continue;

            String platform = null;
            String thumbnail = null;
            Optional<String> ytId = VideoPlatforms.youtubeEmbedId(raw);
            if (ytId.isPresent()) {
                platform = VideoPlatforms.YOUTUBE;
                thumbnail = VideoPlatforms.youtubeThumbnail(ytId.get());
            } else if (VideoPlatforms.isVimeoEmbed(raw)) {
                platform = VideoPlatforms.VIMEO;
            } else if (VideoPlatforms.isDailymotionEmbed(raw)) {
                platform = VideoPlatforms.DAILYMOTION;
            }

            if (platform == null && !hasVideoHint(raw)) continue;

            String src = ctx.resolve(raw);
            if (src == null) continue;
            out.add(new VideoRef(src, "embed", platform, thumbnail));
        }
        return out;
    }

    private static boolean hasVideoHint(String src) {
        for (String h : VIDEO_HINTS) {
            if (src.contains(h)) return true;
        }
        return false;
    }
}
