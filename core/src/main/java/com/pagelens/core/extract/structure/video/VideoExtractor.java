package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 탐지기를 순서대로 실행하고 src 기준으로 한 번에 중복 제거(첫 항목 우선) */
public final class VideoExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(VideoExtractor.class);

    private final List<VideoDetector> detectors;

    public VideoExtractor() {
        this(List.of(
                new HtmlVideoDetector(),
                new IframeVideoDetector(),
                new EmbedObjectVideoDetector(),
                new LinkedVideoDetector(),
                new MetaVideoDetector(),
                new RawUrlVideoDetector()));
    }

    public VideoExtractor(List<VideoDetector> detectors) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors"));
    }

    public List<VideoRef> extract(PageContext ctx) {
        Map<String, VideoRef> bySrc = new LinkedHashMap<>();
        for (VideoDetector d : detectors) {
            List<VideoRef> found;
            try {
                found = d.detect(ctx);
            } catch (RuntimeException e) {
                LOG.debug("video detector {} failed: {}", d.getClass().getSimpleName(), e.toString());
                continue;
            }
            for (VideoRef v : found) {
                if (v != null && v.src() != null && !v.src().isBlank()) {
                    bySrc.putIfAbsent(v.src(), v);
                }
            }
        }
        return new ArrayList<>(bySrc.values());
    }
}
