package com.pagelens.core.extract.structure;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.Heading;

import java.util.List;

/**
 * 제목 후보 탐지 규칙 하나.
 * 규칙끼리는 서로 독립이며 결과는 순서대로 이어 붙인다(상호 중복 제거 없음).
 */
public interface HeadingPass {
    List<Heading> detect(PageContext ctx);
}
