package com.pagelens.core.extract.structure;

import com.pagelens.core.model.ImageRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pagelens.core.extract.PageFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;

class ImageExtractorTest {

    private final ImageExtractor extractor = new ImageExtractor();

    @Test
    void images_then_declared_favicons_without_default() throws Exception {
        List<ImageRef> images = extractor.extract(page("""
                <head>
                  <link rel="icon" href="/icon.png" sizes="32x32">
                  <link rel="apple-touch-icon" href="/apple.png">
                </head>
                <body>
                  <img src="/a.png" alt="A">
                  <img src="a.png" alt="dup">
                  <img src="https://cdn.other.com/b.jpg">
                </body>
                """));

        assertThat(images).containsExactly(
                new ImageRef("https://example.com/a.png", "A"),
                new ImageRef("https://cdn.other.com/b.jpg", ""),
                new ImageRef("https://example.com/icon.png", "Favicon 32x32"),
                new ImageRef("https://example.com/apple.png", "Favicon"));
    }

    @Test
    void declared_favicon_replaces_default() throws Exception {
        List<ImageRef> images = extractor.extract(page("<link rel=\"icon\" href=\"/static/icon.png\">"));

        assertThat(images).containsExactly(new ImageRef("https://example.com/static/icon.png", "Favicon"));
    }

    @Test
    void default_favicon_added_when_no_favicon_link() throws Exception {
        List<ImageRef> images = extractor.extract(page("<img src=\"/a.png\" alt=\"A\">"));

        assertThat(images).containsExactly(
                new ImageRef("https://example.com/a.png", "A"),
                new ImageRef("https://example.com/favicon.ico", "Favicon"));
    }

    @Test
    void default_favicon_not_duplicated_when_declared() throws Exception {
        List<ImageRef> images = extractor.extract(page("<link rel=\"shortcut icon\" href=\"/favicon.ico\">"));

        assertThat(images).extracting(ImageRef::src).containsExactly("https://example.com/favicon.ico");
    }
}
