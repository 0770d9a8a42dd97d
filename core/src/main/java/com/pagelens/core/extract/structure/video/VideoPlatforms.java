package com.pagelens.core.extract.structure.video;

import com.pagelens.core.model.VideoRef;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 알려진 비디오 호스트 판별 + 썸네일 규칙 */
public final class VideoPlatforms {
    private VideoPlatforms() {}

    public static final String YOUTUBE = "youtube";
    public static final String VIMEO = "vimeo";
    public static final String DAILYMOTION = "dailymotion";

    private static final String YT_ID = "([^\"&?/\\s]{11})";

    private static final List<Pattern> YOUTUBE_EMBED = List.of(
            Pattern.compile("youtube\\.com/embed/" + YT_ID),
            Pattern.compile("youtube\\.com/watch\\?v=" + YT_ID),
            Pattern.compile("youtu\\.be/" + YT_ID),
            Pattern.compile("youtube\\.com/v/" + YT_ID),
            Pattern.compile("youtube\\.com/.*[?&]v=" + YT_ID),
            Pattern.compile("youtube-nocookie\\.com/embed/" + YT_ID));

    /** og:video/원시 URL용 느슨한 패턴 */
    private static final Pattern YOUTUBE_ANY =
            Pattern.compile("(?:youtube\\.com|youtu\\.be).*[?&/](?:v=|embed/|v/)" + YT_ID);

    private static final List<Pattern> VIMEO_EMBED = List.of(
            Pattern.compile("vimeo\\.com/video/(\\d+)"),
            Pattern.compile("vimeo\\.com/(\\d+)"),
            Pattern.compile("player\\.vimeo\\.com/video/(\\d+)"),
            Pattern.compile("vimeo\\.com/embed/(\\d+)"));

    private static final Pattern DAILYMOTION_EMBED =
            Pattern.compile("dailymotion\\.com/(?:embed/)?video/([^/?]+)");

    /** iframe src에서 YouTube ID */
    public static Optional<String> youtubeEmbedId(String src) {
        for (Pattern p : YOUTUBE_EMBED) {
            Matcher m = p.matcher(src);
            if (m.find()) return Optional.of(m.group(1));
        }
        return Optional.empty();
    }

    public static Optional<String> youtubeAnyId(String url) {
        Matcher m = YOUTUBE_ANY.matcher(url);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static boolean isVimeoEmbed(String src) {
        if (!src.contains("vimeo.com")) return false;
        for (Pattern p : VIMEO_EMBED) {
            if (p.matcher(src).find()) return true;
        }
        return false;
    }

    public static boolean isDailymotionEmbed(String src) {
        return src.contains("dailymotion.com") && DAILYMOTION_EMBED.matcher(src).find();
    }

    public static String youtubeThumbnail(String videoId) {
        return "https://img.youtube.com/vi/" + videoId + "/maxresdefault.jpg";
    }

    /** og:video/원시 URL용: YouTube(ID 있을 때만) → Vimeo → Dailymotion. 모르면 null */
    public static VideoRef classifyLoose(String url, String fallbackType) {
        if (url.contains("youtube.com") || url.contains("youtu.be")) {
            Optional<String> id = youtubeAnyId(url);
            if (id.isPresent()) {
                return new VideoRef(url, "embed", YOUTUBE, youtubeThumbnail(id.get()));
            }
            return VideoRef.of(url, fallbackType);
        }
        if (url.contains("vimeo.com")) return new VideoRef(url, "embed", VIMEO, null);
        if (url.contains("dailymotion.com")) return new VideoRef(url, "embed", DAILYMOTION, null);
        return VideoRef.of(url, fallbackType);
    }
}
