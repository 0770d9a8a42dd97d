package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 폰트 탐지기 실행 → 첫 family 토큰으로 축약 → 소문자 이름 기준 중복 제거(첫 항목 우선)
 * → 이름순(대소문자 무시) 정렬.
 */
public final class FontExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(FontExtractor.class);

    private final List<FontDetector> detectors;

    public FontExtractor() {
        this(List.of(
                new GoogleFontsDetector(),
                new FontFileDetector(),
                new InlineStyleFontDetector(),
                new StyleBlockFontDetector(),
                new KnownFontDetector()));
    }

    public FontExtractor(List<FontDetector> detectors) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors"));
    }

    public List<FontRef> extract(PageContext ctx) {
        Map<String, FontRef> byName = new LinkedHashMap<>();
        for (FontDetector d : detectors) {
            List<FontRef> found;
            try {
                found = d.detect(ctx);
            } catch (RuntimeException e) {
                LOG.debug("font detector {} failed: {}", d.getClass().getSimpleName(), e.toString());
                continue;
            }
            for (FontRef f : found) {
                String name = FontFamilies.firstFamily(f.name());
                if (name == null) continue;
                byName.putIfAbsent(name.toLowerCase(Locale.ROOT), new FontRef(name, f.source(), f.url(), f.type()));
            }
        }
        List<FontRef> out = new ArrayList<>(byName.values());
        out.sort(Comparator.comparing(FontRef::name, String.CASE_INSENSITIVE_ORDER));
        return out;
    }
}
