package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;

import java.util.List;

/**
 * 폰트 후보 탐지기. name에는 선언 원문(font-family 값 등)을 그대로 담고
 * 첫 family 토큰 축약/일반 키워드 제거/중복 제거는 FontExtractor가 처리한다.
 */
public interface FontDetector {
    List<FontRef> detect(PageContext ctx);
}
