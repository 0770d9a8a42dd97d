package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Heading;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 제목 규칙들을 순서대로 실행해 결과를 이어 붙인다.
 * 휴리스틱 분류기이므로 같은 텍스트가 서로 다른 레벨로 여러 번 나올 수 있다(병합하지 않음).
 */
public final class HeadingExtractor {
    private final List<HeadingPass> passes;

    public HeadingExtractor() {
        this(List.of(
                new NativeHeadingPass(),
                new AriaHeadingPass(),
                new FontSizeHeadingPass(),
                new ClassNameHeadingPass()));
    }

    public HeadingExtractor(List<HeadingPass> passes) {
        this.passes = List.copyOf(Objects.requireNonNull(passes, "passes"));
    }

    public List<Heading> extract(PageContext ctx) {
        List<Heading> out = new ArrayList<>();
        for (HeadingPass p : passes) {
            out.addAll(p.detect(ctx));
        }
        return out;
    }
}
