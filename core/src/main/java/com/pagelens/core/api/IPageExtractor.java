package com.pagelens.core.api;

import com.pagelens.core.model.ExtractedDocument;

/** 렌더링이 끝난 HTML + 원본 URL → 구조화 문서 레코드. */
public interface IPageExtractor {
    ExtractedDocument extract(String html, String sourceUrl) throws ExtractionException;
}
