package com.pagelens.core.extract.lexical;

import org.junit.jupiter.api.Test;

import java.util.SortedSet;

import static com.pagelens.core.extract.PageFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EmailExtractorTest {

    private final EmailExtractor extractor = new EmailExtractor();

    @Test
    void collects_from_every_source_lowercased_and_sorted() throws Exception {
        SortedSet<String> emails = extractor.extract(page("""
                <head><meta name="author" content="Ops Team ops@acme.io"></head>
                <body>
                  <a href="mailto:Sales@Acme.io?subject=Hi">mail us</a>
                  <p>Write to support@acme.io today.</p>
                  <!-- hidden@acme.io -->
                  <span data-email="data@acme.io"></span>
                  <span data-mail="mail@acme.io"></span>
                </body>
                """));

        assertThat(emails).containsExactly(
                "data@acme.io", "hidden@acme.io", "mail@acme.io", "ops@acme.io", "sales@acme.io", "support@acme.io");
    }

    @Test
    void placeholder_addresses_are_dropped() throws Exception {
        SortedSet<String> emails = extractor.extract(page("""
                <p>user@example.com test@acme.io noreply@acme.io no-reply@acme.io real@acme.io</p>
                """));

        assertThat(emails).containsExactly("real@acme.io");
    }

    @Test
    void acceptance_rules() {
        assertTrue(EmailExtractor.isAcceptable("a@b.io"));
        assertFalse(EmailExtractor.isAcceptable("@b.io"));
        assertFalse(EmailExtractor.isAcceptable("a@"));
        assertFalse(EmailExtractor.isAcceptable("a@b@c.io"));
        assertFalse(EmailExtractor.isAcceptable("abc"));
        assertFalse(EmailExtractor.isAcceptable("someone@example.com"));
    }
}
