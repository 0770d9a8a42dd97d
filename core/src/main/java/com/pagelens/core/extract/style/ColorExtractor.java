package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.ColorSwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/** 색 소스 실행 → 팔레트 집계 → 상위 maxColors (최대 50) */
public final class ColorExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ColorExtractor.class);

    public static final int MAX_COLORS = 50;

    private final List<ColorSource> sources;
    private final int maxColors;

    public ColorExtractor(int maxColors) {
        this(List.of(new InlineStyleColorSource(), new StyleBlockColorSource(), new RawMarkupColorSource()), maxColors);
    }

    public ColorExtractor(List<ColorSource> sources, int maxColors) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        this.maxColors = Math.max(1, Math.min(MAX_COLORS, maxColors));
    }

    public List<ColorSwatch> extract(PageContext ctx) {
        ColorPalette palette = new ColorPalette();
        for (ColorSource s : sources) {
            try {
                s.collect(ctx).forEach(palette::add);
            } catch (RuntimeException e) {
                LOG.debug("color source {} failed: {}", s.getClass().getSimpleName(), e.toString());
            }
        }
        return palette.top(maxColors);
    }
}
