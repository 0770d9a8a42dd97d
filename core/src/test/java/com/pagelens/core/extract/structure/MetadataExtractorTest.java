package com.pagelens.core.extract.structure;

import org.junit.jupiter.api.Test;

import static com.pagelens.core.extract.PageFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;

class MetadataExtractorTest {

    private final MetadataExtractor extractor = new MetadataExtractor();

    @Test
    void reads_title_description_og_image_and_resources() throws Exception {
        PageMetadata m = extractor.extract(page("""
                <html><head>
                  <title> Shop </title>
                  <meta property="og:description" content="OG desc">
                  <meta name="twitter:image" content="/tw.png">
                  <meta charset="utf-8">
                  <link rel="stylesheet" href="/s.css">
                  <script src="//cdn.other.com/app.js"></script>
                  <script>inline()</script>
                </head><body>
                  <p>First  para.</p><p>Second.</p>
                </body></html>
                """));

        assertThat(m.title()).isEqualTo("Shop");
        assertThat(m.description()).isEqualTo("OG desc");
        assertThat(m.ogImage()).isEqualTo("https://example.com/tw.png");
        assertThat(m.favicon()).isEqualTo("https://example.com/favicon.ico");
        assertThat(m.stylesheets()).containsExactly("https://example.com/s.css");
        assertThat(m.scripts()).containsExactly("https://cdn.other.com/app.js");
        assertThat(m.textContent()).isEqualTo("First para. Second.");
        assertThat(m.metaTags()).containsOnlyKeys("og:description", "twitter:image");
    }

    @Test
    void name_description_wins_over_og_and_meta_last_write_wins() throws Exception {
        PageMetadata m = extractor.extract(page("""
                <meta name="description" content="plain">
                <meta property="og:description" content="og">
                <meta name="robots" content="index">
                <meta name="robots" content="noindex">
                """));

        assertThat(m.description()).isEqualTo("plain");
        assertThat(m.metaTags()).containsEntry("robots", "noindex");
        assertThat(m.ogImage()).isNull();
    }

    @Test
    void favicon_follows_selector_priority() throws Exception {
        PageMetadata m = extractor.extract(page("""
                <link rel="apple-touch-icon" href="/apple.png">
                <link rel="icon" href="/icon.svg">
                """));

        assertThat(m.favicon()).isEqualTo("https://example.com/icon.svg");
    }
}
