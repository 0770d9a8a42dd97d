package com.pagelens.core.model;

import java.util.List;
import java.util.Objects;

/** 본문 추출 옵션. 저장 상태 없음(요청 단위 값) */
public final class ContentExtractionOptions {

    public enum OutputFormat { TEXT, HTML, MARKDOWN, JSON }

    private OutputFormat outputFormat = OutputFormat.MARKDOWN;
    private boolean textOnly = false;
    private boolean ignoreLinks = false;
    private List<String> includeElements = List.of();
    private List<String> excludeElements = List.of();

    public static ContentExtractionOptions defaults() { return new ContentExtractionOptions(); }

    // ---------- getters ----------
    public OutputFormat getOutputFormat() { return outputFormat == null ? OutputFormat.MARKDOWN : outputFormat; }
    public boolean isTextOnly() { return textOnly; }
    public boolean isIgnoreLinks() { return ignoreLinks; }
    public List<String> getIncludeElements() { return includeElements; }
    public List<String> getExcludeElements() { return excludeElements; }

    // ---------- fluent setters ----------
    public ContentExtractionOptions setOutputFormat(OutputFormat f) {
        this.outputFormat = (f != null ? f : OutputFormat.MARKDOWN);
        return this;
    }
    public ContentExtractionOptions setTextOnly(boolean v) { this.textOnly = v; return this; }
    public ContentExtractionOptions setIgnoreLinks(boolean v) { this.ignoreLinks = v; return this; }

    /** 빈 문자열 셀렉터는 무시 */
    public ContentExtractionOptions setIncludeElements(List<String> selectors) {
        this.includeElements = cleanSelectors(selectors);
        return this;
    }
    public ContentExtractionOptions setExcludeElements(List<String> selectors) {
        this.excludeElements = cleanSelectors(selectors);
        return this;
    }

    public void validate() {
        Objects.requireNonNull(includeElements, "includeElements");
        Objects.requireNonNull(excludeElements, "excludeElements");
    }

    private static List<String> cleanSelectors(List<String> in) {
        if (in == null || in.isEmpty()) return List.of();
        return in.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
