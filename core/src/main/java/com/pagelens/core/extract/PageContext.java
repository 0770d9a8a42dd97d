package com.pagelens.core.extract;

import com.pagelens.core.model.NormalizedUrl;
import com.pagelens.core.util.UrlResolver;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.Objects;

/**
 * 한 번 파싱한 문서 + 기준 URL.
 * 직렬화 마크업/전체 텍스트는 생성 시 한 번만 계산해 모든 추출기가 공유한다.
 * 추출기는 document를 읽기만 한다(수정 금지).
 */
public final class PageContext {
    private final Document document;
    private final NormalizedUrl baseUrl;
    private final String markup;
    private final String fullText;

    private PageContext(Document document, NormalizedUrl baseUrl) {
        this.document = document;
        this.baseUrl = baseUrl;
        this.markup = document.outerHtml();
        this.fullText = document.text();
    }

    public static PageContext parse(String html, NormalizedUrl baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Document doc = Jsoup.parse(html == null ? "" : html, baseUrl.url());
        return new PageContext(doc, baseUrl);
    }

    public Document document() { return document; }
    public NormalizedUrl baseUrl() { return baseUrl; }
    public String origin() { return baseUrl.origin(); }
    /** 문서 전체 직렬화 HTML(원시 정규식 스윕용) */
    public String markup() { return markup; }
    /** 문서 전체 텍스트(공백 정리됨, script/style 제외) */
    public String fullText() { return fullText; }

    /** 상대 참조 → 절대 URL. 실패 시 null */
    public String resolve(String reference) {
        return UrlResolver.resolve(reference, baseUrl);
    }

    public boolean isExternal(String absoluteHref) {
        return UrlResolver.isExternal(absoluteHref, baseUrl);
    }
}
