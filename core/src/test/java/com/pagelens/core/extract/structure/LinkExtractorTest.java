package com.pagelens.core.extract.structure;

import com.pagelens.core.model.Link;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pagelens.core.extract.PageFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;

class LinkExtractorTest {

    private final LinkExtractor extractor = new LinkExtractor();

    @Test
    void resolves_and_classifies_internal_and_external() throws Exception {
        List<Link> links = extractor.extract(page("""
                <a href="/about">About</a>
                <a href="https://other.com">x</a>
                """));

        assertThat(links).containsExactly(
                new Link("About", "https://example.com/about", false),
                new Link("x", "https://other.com", true));
    }

    @Test
    void skips_pseudo_links() throws Exception {
        List<Link> links = extractor.extract(page("""
                <a href="">empty</a>
                <a href="javascript:void(0)">js</a>
                <a href="JavaScript:alert(1)">js2</a>
                <a href="mailto:a@acme.io">mail</a>
                <a href="tel:+12125550000">tel</a>
                <a href="/ok">ok</a>
                """));

        assertThat(links).extracting(Link::href).containsExactly("https://example.com/ok");
    }

    @Test
    void text_falls_back_to_aria_label_then_title_then_href() throws Exception {
        List<Link> links = extractor.extract(page("""
                <a href="/a" aria-label="Aria"></a>
                <a href="/b" title="Title"></a>
                <a href="/c"></a>
                """));

        assertThat(links).extracting(Link::text).containsExactly("Aria", "Title", "/c");
    }

    @Test
    void dedupes_by_resolved_href_first_wins() throws Exception {
        List<Link> links = extractor.extract(page("""
                <a href="/same">first</a>
                <a href="https://example.com/same">second</a>
                """));

        assertThat(links).containsExactly(new Link("first", "https://example.com/same", false));
    }
}
