package com.pagelens.core.api;

import com.pagelens.core.model.ContentExtractionOptions;

/** include/exclude 셀렉터로 본문을 좁힌 뒤 지정 포맷 문자열로 렌더링한다. */
public interface IContentExtractor {
    String extract(String html, String sourceUrl, ContentExtractionOptions options) throws ExtractionException;
}
