package com.pagelens.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

class ExtractedDocumentTest {

    @Test
    void missing_fields_default_to_empty() {
        ExtractedDocument doc = ExtractedDocument.builder().sourceUrl("https://ex.com").build();

        assertThat(doc.getTitle()).isEmpty();
        assertThat(doc.getLinks()).isEmpty();
        assertThat(doc.getEmails()).isEmpty();
        assertThat(doc.getMetaTags()).isEmpty();
        assertThat(doc.getOgImage()).isEmpty();
        assertThat(doc.getRobotsTxt()).isEmpty();
        assertThat(doc.getHtml()).isEmpty();
    }

    @Test
    void source_url_is_required() {
        assertThatThrownBy(() -> ExtractedDocument.builder().build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void more_than_50_colors_is_rejected() {
        List<ColorSwatch> colors = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            String hex = String.format("#%06x", i);
            colors.add(new ColorSwatch(hex, hex, "rgb(0, 0, " + i + ")", "Text", 1));
        }
        assertThatThrownBy(() -> ExtractedDocument.builder().sourceUrl("https://ex.com").colors(colors).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void collections_are_copied_and_read_only() {
        List<Link> links = new ArrayList<>(List.of(new Link("a", "https://ex.com/a", false)));
        TreeSet<String> emails = new TreeSet<>(List.of("b@ex.com", "a@ex.com"));
        ExtractedDocument doc = ExtractedDocument.builder()
                .sourceUrl("https://ex.com")
                .links(links)
                .emails(emails)
                .build();

        links.clear();
        emails.add("z@ex.com");

        assertThat(doc.getLinks()).hasSize(1);
        assertThat(doc.getEmails()).containsExactly("a@ex.com", "b@ex.com");
        assertThatThrownBy(() -> doc.getLinks().add(new Link("x", "y", true)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> doc.getEmails().add("c@ex.com"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
