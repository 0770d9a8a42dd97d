package com.pagelens.core.extract;

import com.pagelens.core.api.ErrorKind;
import com.pagelens.core.api.ExtractionException;
import com.pagelens.core.model.ExtractedDocument;
import com.pagelens.core.model.ExtractorConfig;
import com.pagelens.core.model.Link;
import com.pagelens.core.robots.RobotsFetcher;
import com.pagelens.core.robots.RobotsRepository;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PageExtractorTest {

    private static final String HTML = """
            <html><head>
              <title>Acme</title>
              <meta name="description" content="Tools">
              <link rel="stylesheet" href="/main.css">
            </head><body style="background-color: #fafafa">
              <h1>Welcome</h1>
              <p>Contact sales@acme.io or +1 212 736 5000.</p>
              <a href="/about">About</a>
              <a href="https://other.com">x</a>
              <a href="/about">About again</a>
              <img src="/logo.png" alt="Logo">
              <p style="font-family: 'Open Sans', sans-serif; color: #333">Body</p>
            </body></html>
            """;

    private static PageExtractor withoutRobots() {
        return new PageExtractor(new DocumentAssembler(ExtractorConfig.defaults()), null);
    }

    @Test
    void assembles_every_fact_type() throws Exception {
        ExtractedDocument doc = withoutRobots().extract(HTML, "acme.io");

        assertEquals("https://acme.io", doc.getSourceUrl());
        assertEquals("Acme", doc.getTitle());
        assertEquals("Tools", doc.getDescription());
        assertThat(doc.getHeadings()).extracting(h -> h.level() + ":" + h.text()).contains("h1:Welcome");
        assertThat(doc.getLinks()).containsExactly(
                new Link("About", "https://acme.io/about", false),
                new Link("x", "https://other.com", true));
        assertThat(doc.getImages()).extracting(i -> i.src())
                .containsExactly("https://acme.io/logo.png", "https://acme.io/favicon.ico");
        assertThat(doc.getEmails()).containsExactly("sales@acme.io");
        assertThat(doc.getPhoneNumbers()).contains("+1 212-736-5000");
        assertThat(doc.getFonts()).extracting(f -> f.name()).contains("Open Sans");
        assertThat(doc.getColors()).extracting(c -> c.hex()).contains("#fafafa", "#333333");
        assertThat(doc.getStylesheets()).containsExactly("https://acme.io/main.css");
        assertThat(doc.getFavicon()).contains("https://acme.io/favicon.ico");
        assertThat(doc.getRobotsTxt()).isEmpty();
        assertEquals(HTML, doc.getHtml());
    }

    @Test
    void extraction_is_deterministic() throws Exception {
        PageExtractor ex = withoutRobots();
        ExtractedDocument a = ex.extract(HTML, "https://acme.io");
        ExtractedDocument b = ex.extract(HTML, "https://acme.io");

        assertEquals(a.getLinks(), b.getLinks());
        assertEquals(a.getColors(), b.getColors());
        assertEquals(a.getFonts(), b.getFonts());
        assertEquals(a.getPhoneNumbers(), b.getPhoneNumbers());
        assertEquals(a.getHeadings(), b.getHeadings());
    }

    @Test
    void robots_txt_is_attached_when_available() throws Exception {
        List<URI> asked = new ArrayList<>();
        RobotsFetcher fetcher = uri -> {
            asked.add(uri);
            return RobotsFetcher.Response.ok(200, "User-agent: *\n", uri);
        };
        PageExtractor ex = new PageExtractor(
                new DocumentAssembler(ExtractorConfig.defaults()),
                new RobotsRepository(fetcher, () -> 0L));

        ExtractedDocument doc = ex.extract(HTML, "https://acme.io/shop/item");

        assertThat(doc.getRobotsTxt()).contains("User-agent: *\n");
        assertThat(asked).containsExactly(URI.create("https://acme.io/robots.txt"));
    }

    @Test
    void robots_failure_does_not_fail_extraction() throws Exception {
        PageExtractor ex = new PageExtractor(
                new DocumentAssembler(ExtractorConfig.defaults()),
                new RobotsRepository(uri -> RobotsFetcher.Response.fail("timeout", uri), () -> 0L));

        assertThat(ex.extract(HTML, "https://acme.io").getRobotsTxt()).isEmpty();
    }

    @Test
    void url_is_validated_before_anything_else() {
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> withoutRobots().extract(HTML, "http://192.168.0.1/admin"));
        assertEquals(ErrorKind.FORBIDDEN_TARGET, e.getKind());
    }

    @Test
    void blank_html_is_empty_response() {
        assertEquals(ErrorKind.EMPTY_RESPONSE,
                assertThrows(ExtractionException.class, () -> withoutRobots().extract(" \n", "https://acme.io")).getKind());
        assertEquals(ErrorKind.EMPTY_RESPONSE,
                assertThrows(ExtractionException.class, () -> withoutRobots().extract(null, "https://acme.io")).getKind());
    }

    @Test
    void palette_cap_follows_config() throws Exception {
        StringBuilder html = new StringBuilder("<style>");
        for (int i = 1; i <= 20; i++) html.append(String.format(".c%d{color:#%06x}", i, i));
        html.append("</style>");

        PageExtractor ex = new PageExtractor(new DocumentAssembler(ExtractorConfig.defaults().setMaxColors(5)), null);
        assertThat(ex.extract(html.toString(), "https://acme.io").getColors()).hasSize(5);
    }
}
