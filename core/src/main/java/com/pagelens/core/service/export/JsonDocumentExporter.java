package com.pagelens.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pagelens.core.model.ColorSwatch;
import com.pagelens.core.model.ExtractedDocument;
import com.pagelens.core.model.FontRef;
import com.pagelens.core.model.Heading;
import com.pagelens.core.model.ImageRef;
import com.pagelens.core.model.Link;
import com.pagelens.core.model.VideoRef;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * ExtractedDocument → JSON.
 * 필드 순서 고정(meta → 문서 필드). Optional 필드는 값이 없으면 null.
 * 원본 HTML은 요청할 때만 포함한다.
 */
public final class JsonDocumentExporter {

    static final String FORMAT_VERSION = "1.0";

    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonDocumentExporter() {
        this(Clock.systemUTC());
    }

    public JsonDocumentExporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(ExtractedDocument doc) {
        return toJson(doc, false);
    }

    public String toJson(ExtractedDocument doc, boolean includeHtml) {
        try {
            return mapper.writeValueAsString(toTree(doc, includeHtml));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** 파일로 저장(덮어쓰기). 상위 디렉터리는 필요 시 생성 */
    public Path export(ExtractedDocument doc, Path outFile) throws IOException {
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(outFile, toJson(doc), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    ObjectNode toTree(ExtractedDocument doc, boolean includeHtml) {
        Objects.requireNonNull(doc, "doc");
        ObjectNode root = mapper.createObjectNode();

        ObjectNode meta = root.putObject("meta");
        meta.put("formatVersion", FORMAT_VERSION);
        meta.putPOJO("exportedAt", Instant.now(clock));

        root.put("url", doc.getSourceUrl());
        root.put("title", doc.getTitle());
        root.put("description", doc.getDescription());
        root.put("ogImage", doc.getOgImage().orElse(null));
        root.put("favicon", doc.getFavicon().orElse(null));

        ArrayNode headings = root.putArray("headings");
        for (Heading h : doc.getHeadings()) {
            headings.addObject().put("level", h.level()).put("text", h.text());
        }

        ArrayNode links = root.putArray("links");
        for (Link l : doc.getLinks()) {
            links.addObject().put("text", l.text()).put("href", l.href()).put("external", l.external());
        }

        ArrayNode images = root.putArray("images");
        for (ImageRef i : doc.getImages()) {
            images.addObject().put("src", i.src()).put("alt", i.alt());
        }

        ArrayNode videos = root.putArray("videos");
        for (VideoRef v : doc.getVideos()) {
            ObjectNode n = videos.addObject().put("src", v.src()).put("type", v.type());
            v.platformOpt().ifPresent(p -> n.put("platform", p));
            v.thumbnailOpt().ifPresent(t -> n.put("thumbnail", t));
        }

        ArrayNode fonts = root.putArray("fonts");
        for (FontRef f : doc.getFonts()) {
            ObjectNode n = fonts.addObject().put("name", f.name()).put("source", f.source());
            if (f.url() != null) n.put("url", f.url());
            if (f.type() != null) n.put("type", f.type());
        }

        ArrayNode colors = root.putArray("colors");
        for (ColorSwatch c : doc.getColors()) {
            colors.addObject()
                    .put("value", c.value())
                    .put("hex", c.hex())
                    .put("rgb", c.rgb())
                    .put("usage", c.usage())
                    .put("frequency", c.frequency());
        }

        strings(root.putArray("emails"), doc.getEmails());
        strings(root.putArray("phoneNumbers"), doc.getPhoneNumbers());

        ObjectNode metaTags = root.putObject("metaTags");
        for (Map.Entry<String, String> e : doc.getMetaTags().entrySet()) {
            metaTags.put(e.getKey(), e.getValue());
        }

        strings(root.putArray("scripts"), doc.getScripts());
        strings(root.putArray("stylesheets"), doc.getStylesheets());
        root.put("textContent", doc.getTextContent());
        root.put("robotsTxt", doc.getRobotsTxt().orElse(null));
        if (includeHtml) {
            root.put("html", doc.getHtml());
        }
        return root;
    }

    private static void strings(ArrayNode arr, Collection<String> values) {
        values.forEach(arr::add);
    }
}
