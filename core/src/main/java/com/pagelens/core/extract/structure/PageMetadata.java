package com.pagelens.core.extract.structure;

import java.util.List;
import java.util.Map;

/** 문서 메타 정보 묶음(제목/설명/대표 이미지/파비콘/메타 태그/리소스/본문 텍스트) */
public record PageMetadata(
        String title,
        String description,
        String ogImage,
        String favicon,
        Map<String, String> metaTags,
        List<String> scripts,
        List<String> stylesheets,
        String textContent) {}
