package com.pagelens.core.service;

import com.pagelens.core.api.ErrorKind;
import com.pagelens.core.api.ExtractionException;
import com.pagelens.core.api.IContentExtractor;
import com.pagelens.core.api.IPageExtractor;
import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.content.ContentExtractor;
import com.pagelens.core.extract.PageExtractor;
import com.pagelens.core.http.HttpPageFetcher;
import com.pagelens.core.model.ContentExtractionOptions;
import com.pagelens.core.model.ExtractedDocument;
import com.pagelens.core.model.ExtractorConfig;
import com.pagelens.core.model.FetchedPage;
import com.pagelens.core.model.NormalizedUrl;
import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.UrlResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 추출 파사드:
 *  - URL 검증(SSRF 게이트) → fetch → 추출
 *  - 검증은 항상 fetch보다 먼저. 거부된 URL로는 어떤 요청도 나가지 않는다
 *  - 재시도는 fetcher 책임. 여기서는 결과 상태만 판정한다
 */
public final class ExtractionService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExtractionService.class);

    private final IPageFetcher fetcher;
    private final IPageExtractor pageExtractor;
    private final IContentExtractor contentExtractor;

    /** 기본 구현 */
    public ExtractionService(ExtractorConfig config) {
        this(new HttpPageFetcher(validated(config)), new PageExtractor(config), new ContentExtractor());
    }

    /** DI/테스트용 */
    public ExtractionService(IPageFetcher fetcher, IPageExtractor pageExtractor, IContentExtractor contentExtractor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.pageExtractor = Objects.requireNonNull(pageExtractor, "pageExtractor");
        this.contentExtractor = Objects.requireNonNull(contentExtractor, "contentExtractor");
    }

    /* =========================
       이미 렌더링된 HTML
       ========================= */

    public ExtractedDocument extract(String html, String sourceUrl) throws ExtractionException {
        return pageExtractor.extract(html, sourceUrl);
    }

    public String extractContent(String html, String sourceUrl, ContentExtractionOptions options) throws ExtractionException {
        return contentExtractor.extract(html, sourceUrl, options);
    }

    /* =========================
       URL → fetch → 추출
       ========================= */

    public ExtractedDocument extractUrl(String rawUrl) throws ExtractionException {
        NormalizedUrl url = UrlResolver.normalize(rawUrl);
        String html = fetchHtml(url);
        return pageExtractor.extract(html, url.url());
    }

    public String extractContentFromUrl(String rawUrl, ContentExtractionOptions options) throws ExtractionException {
        NormalizedUrl url = UrlResolver.normalize(rawUrl);
        String html = fetchHtml(url);
        return contentExtractor.extract(html, url.url(), options);
    }

    private String fetchHtml(NormalizedUrl url) throws ExtractionException {
        LOG.info("Fetch start: {}", url);
        FetchedPage page = fetcher.fetch(url.uri());
        int status = page.getStatusCode();

        if (status < 200 || status >= 300) {
            String reason = page.getError().orElse("HTTP " + status);
            LOG.warn("Fetch failed: {} -> {}", url, reason);
            SLOG.warn("fetch.fail", "url", url.url(), "status", status, "reason", reason);
            throw new ExtractionException(ErrorKind.FETCH_FAILURE, "Failed to fetch website: " + reason);
        }
        String body = page.getBody();
        if (body == null || body.isBlank()) {
            SLOG.warn("fetch.empty", "url", url.url(), "status", status);
            throw new ExtractionException(ErrorKind.EMPTY_RESPONSE, "Website returned empty response: " + url);
        }

        SLOG.info("fetch.done", "url", url.url(), "status", status,
                "ms", page.getResponseTimeMs(), "bytes", body.length());
        return body;
    }

    @Override
    public void close() throws Exception {
        fetcher.close();
    }

    private static ExtractorConfig validated(ExtractorConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }
}
