package com.pagelens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 한 번의 추출 결과(불변).
 * - 빌더로 한 번 생성 후 변경 없음(create-then-return)
 * - 컬렉션 필드는 모두 불변 사본
 * - links/images/videos/fonts/colors는 추출 단계에서 식별 키 기준 중복 제거 완료 상태
 */
public final class ExtractedDocument {
    private final String sourceUrl;
    private final String title;
    private final String description;
    private final String ogImage;
    private final String favicon;
    private final List<Heading> headings;
    private final List<Link> links;
    private final List<ImageRef> images;
    private final List<VideoRef> videos;
    private final List<FontRef> fonts;
    private final List<ColorSwatch> colors;
    private final SortedSet<String> emails;
    private final SortedSet<String> phoneNumbers;
    private final Map<String, String> metaTags;
    private final List<String> scripts;
    private final List<String> stylesheets;
    private final String textContent;
    private final String robotsTxt;
    private final String html;

    private ExtractedDocument(Builder b) {
        this.sourceUrl = b.sourceUrl;
        this.title = b.title == null ? "" : b.title;
        this.description = b.description == null ? "" : b.description;
        this.ogImage = b.ogImage;
        this.favicon = b.favicon;
        this.headings = List.copyOf(b.headings);
        this.links = List.copyOf(b.links);
        this.images = List.copyOf(b.images);
        this.videos = List.copyOf(b.videos);
        this.fonts = List.copyOf(b.fonts);
        this.colors = List.copyOf(b.colors);
        this.emails = Collections.unmodifiableSortedSet(new TreeSet<>(b.emails));
        this.phoneNumbers = Collections.unmodifiableSortedSet(new TreeSet<>(b.phoneNumbers));
        this.metaTags = Collections.unmodifiableMap(new LinkedHashMap<>(b.metaTags));
        this.scripts = List.copyOf(b.scripts);
        this.stylesheets = List.copyOf(b.stylesheets);
        this.textContent = b.textContent == null ? "" : b.textContent;
        this.robotsTxt = b.robotsTxt;
        this.html = b.html == null ? "" : b.html;
    }

    public String getSourceUrl() { return sourceUrl; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Optional<String> getOgImage() { return Optional.ofNullable(ogImage); }
    public Optional<String> getFavicon() { return Optional.ofNullable(favicon); }
    public List<Heading> getHeadings() { return headings; }
    public List<Link> getLinks() { return links; }
    public List<ImageRef> getImages() { return images; }
    public List<VideoRef> getVideos() { return videos; }
    public List<FontRef> getFonts() { return fonts; }
    public List<ColorSwatch> getColors() { return colors; }
    public SortedSet<String> getEmails() { return emails; }
    public SortedSet<String> getPhoneNumbers() { return phoneNumbers; }
    public Map<String, String> getMetaTags() { return metaTags; }
    public List<String> getScripts() { return scripts; }
    public List<String> getStylesheets() { return stylesheets; }
    public String getTextContent() { return textContent; }
    public Optional<String> getRobotsTxt() { return Optional.ofNullable(robotsTxt); }
    /** 추출에 사용한 원본 HTML(내보내기 기본값에서는 제외) */
    public String getHtml() { return html; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sourceUrl;
        private String title;
        private String description;
        private String ogImage;
        private String favicon;
        private List<Heading> headings = List.of();
        private List<Link> links = List.of();
        private List<ImageRef> images = List.of();
        private List<VideoRef> videos = List.of();
        private List<FontRef> fonts = List.of();
        private List<ColorSwatch> colors = List.of();
        private SortedSet<String> emails = new TreeSet<>();
        private SortedSet<String> phoneNumbers = new TreeSet<>();
        private Map<String, String> metaTags = Map.of();
        private List<String> scripts = List.of();
        private List<String> stylesheets = List.of();
        private String textContent;
        private String robotsTxt;
        private String html;

        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder ogImage(String ogImage) { this.ogImage = ogImage; return this; }
        public Builder favicon(String favicon) { this.favicon = favicon; return this; }
        public Builder headings(List<Heading> v) { this.headings = nn(v); return this; }
        public Builder links(List<Link> v) { this.links = nn(v); return this; }
        public Builder images(List<ImageRef> v) { this.images = nn(v); return this; }
        public Builder videos(List<VideoRef> v) { this.videos = nn(v); return this; }
        public Builder fonts(List<FontRef> v) { this.fonts = nn(v); return this; }
        public Builder colors(List<ColorSwatch> v) { this.colors = nn(v); return this; }
        public Builder emails(SortedSet<String> v) { this.emails = (v == null ? new TreeSet<>() : v); return this; }
        public Builder phoneNumbers(SortedSet<String> v) { this.phoneNumbers = (v == null ? new TreeSet<>() : v); return this; }
        public Builder metaTags(Map<String, String> v) { this.metaTags = (v == null ? Map.of() : v); return this; }
        public Builder scripts(List<String> v) { this.scripts = nn(v); return this; }
        public Builder stylesheets(List<String> v) { this.stylesheets = nn(v); return this; }
        public Builder textContent(String textContent) { this.textContent = textContent; return this; }
        public Builder robotsTxt(String robotsTxt) { this.robotsTxt = robotsTxt; return this; }
        public Builder html(String html) { this.html = html; return this; }

        public ExtractedDocument build() {
            Objects.requireNonNull(sourceUrl, "sourceUrl");
            if (colors.size() > 50) {
                throw new IllegalStateException("colors must be capped at 50 but was " + colors.size());
            }
            return new ExtractedDocument(this);
        }

        private static <T> List<T> nn(List<T> v) { return v == null ? List.of() : v; }
    }
}
