package com.pagelens.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagelens.core.model.ColorSwatch;
import com.pagelens.core.model.ExtractedDocument;
import com.pagelens.core.model.FontRef;
import com.pagelens.core.model.Heading;
import com.pagelens.core.model.Link;
import com.pagelens.core.model.VideoRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class JsonDocumentExporterTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-03-01T21:34:00Z"), ZoneOffset.UTC);
    private static final ObjectMapper M = new ObjectMapper();

    @TempDir
    Path tmp;

    private static ExtractedDocument sample() {
        return ExtractedDocument.builder()
                .sourceUrl("https://ex.com")
                .title("Ex")
                .favicon("https://ex.com/favicon.ico")
                .headings(List.of(Heading.of(1, "Hello")))
                .links(List.of(new Link("About", "https://ex.com/about", false)))
                .videos(List.of(new VideoRef("https://www.youtube.com/embed/abc", "embed", "YouTube", null)))
                .fonts(List.of(FontRef.of("Roboto", "Inline Style")))
                .colors(List.of(new ColorSwatch("#fff", "#ffffff", "rgb(255, 255, 255)", "Background", 2)))
                .emails(new TreeSet<>(List.of("a@ex.com")))
                .metaTags(Map.of("description", "x"))
                .html("<html></html>")
                .build();
    }

    @Test
    void exports_meta_and_document_fields() throws Exception {
        JsonNode n = M.readTree(new JsonDocumentExporter(FIXED).toJson(sample()));

        assertThat(n.path("meta").path("formatVersion").asText()).isEqualTo("1.0");
        assertThat(n.path("meta").path("exportedAt").asText()).isEqualTo("2025-03-01T21:34:00Z");
        assertThat(n.path("url").asText()).isEqualTo("https://ex.com");
        assertThat(n.path("ogImage").isNull()).isTrue();
        assertThat(n.path("headings").get(0).path("level").asText()).isEqualTo("h1");
        assertThat(n.path("links").get(0).path("external").asBoolean()).isFalse();
        assertThat(n.path("videos").get(0).path("platform").asText()).isEqualTo("YouTube");
        assertThat(n.path("videos").get(0).has("thumbnail")).isFalse();
        assertThat(n.path("fonts").get(0).has("url")).isFalse();
        assertThat(n.path("colors").get(0).path("frequency").asInt()).isEqualTo(2);
        assertThat(n.path("emails").get(0).asText()).isEqualTo("a@ex.com");
        assertThat(n.path("metaTags").path("description").asText()).isEqualTo("x");
        assertThat(n.path("robotsTxt").isNull()).isTrue();
    }

    @Test
    void html_only_when_requested() throws Exception {
        JsonDocumentExporter ex = new JsonDocumentExporter(FIXED);
        assertThat(M.readTree(ex.toJson(sample())).has("html")).isFalse();
        assertThat(M.readTree(ex.toJson(sample(), true)).path("html").asText()).isEqualTo("<html></html>");
    }

    @Test
    void export_writes_file_and_creates_parent() throws Exception {
        Path out = tmp.resolve("nested/dir/page.json");
        Path written = new JsonDocumentExporter(FIXED).export(sample(), out);

        assertThat(written).exists();
        assertThat(M.readTree(Files.readString(written)).path("title").asText()).isEqualTo("Ex");
    }
}
