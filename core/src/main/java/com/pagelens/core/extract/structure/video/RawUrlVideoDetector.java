package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 직렬화된 마크업 전체를 정규식으로 훑어 스크립트/데이터 속성 안의 비디오 URL을 찾는다.
 * 엔티티(&amp; 등)는 먼저 복원한다.
 */
public final class RawUrlVideoDetector implements VideoDetector {
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("https?://[^\\s\"<>]+\\.(?:mp4|webm|ogg|mov|avi|wmv|flv|mkv)(?:\\?[^\\s\"<>]*)?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("https?://[^\\s\"<>]*youtube\\.com[^\\s\"<>]*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("https?://[^\\s\"<>]*youtu\\.be[^\\s\"<>]*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("https?://[^\\s\"<>]*vimeo\\.com[^\\s\"<>]*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("https?://[^\\s\"<>]*dailymotion\\.com[^\\s\"<>]*", Pattern.CASE_INSENSITIVE));

    @Override
    public List<VideoRef> detect(PageContext ctx) {
        String html = Parser.unescapeEntities(ctx.markup(), false);
        List<VideoRef> out = new ArrayList<>();
        for (Pattern p : PATTERNS) {
            Matcher m = p.matcher(html);
            while (m.find()) {
                String url = m.group().trim();
                if (!url.isEmpty()) {
                    out.add(VideoPlatforms.classifyLoose(url, "direct"));
                }
            }
        }
        return out;
    }
}
