package com.pagelens.core.extract.style;

import com.pagelens.core.model.ColorSwatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** hex 기준 빈도 집계. 추출 호출 1회당 1개 (공유 금지) */
final class ColorPalette {

    private static final class Entry {
        final String value;
        final String hex;
        final List<String> usages = new ArrayList<>();
        int frequency;

        Entry(String value, String hex) {
            this.value = value;
            this.hex = hex;
        }
    }

    private final Map<String, Entry> byHex = new LinkedHashMap<>();

    void add(ColorSample sample) {
        String hex = CssColors.toHex(sample.value());
        if (hex == null) return;

        Entry e = byHex.computeIfAbsent(hex, h -> new Entry(sample.value().trim(), h));
        e.frequency++;
        if (!e.usages.contains(sample.usage())) e.usages.add(sample.usage());
    }

    /** 빈도 내림차순 → hex 오름차순, 상위 limit개 */
    List<ColorSwatch> top(int limit) {
        return byHex.values().stream()
                .sorted(Comparator.<Entry>comparingInt(e -> e.frequency).reversed()
                        .thenComparing(e -> e.hex))
                .limit(limit)
                .map(e -> new ColorSwatch(e.value, e.hex, CssColors.toRgb(e.hex),
                        String.join(", ", e.usages), e.frequency))
                .toList();
    }
}
