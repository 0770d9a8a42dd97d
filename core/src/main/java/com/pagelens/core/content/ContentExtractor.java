package com.pagelens.core.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagelens.core.api.ErrorKind;
import com.pagelens.core.api.ExtractionException;
import com.pagelens.core.api.IContentExtractor;
import com.pagelens.core.model.ContentExtractionOptions;
import com.pagelens.core.model.NormalizedUrl;
import com.pagelens.core.util.UrlResolver;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * 본문 선택/포맷터.
 * body 사본 → include(복제 수집, 매칭 없으면 원본 유지) → exclude 제거
 * → script/style/noscript 제거 → (ignoreLinks) 앵커를 텍스트로 치환 → 포맷 렌더링.
 * 입력 문서는 건드리지 않는다.
 */
public final class ContentExtractor implements IContentExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ContentExtractor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String extract(String html, String sourceUrl, ContentExtractionOptions options) throws ExtractionException {
        NormalizedUrl base = UrlResolver.normalize(sourceUrl);
        if (html == null || html.isBlank()) {
            throw new ExtractionException(ErrorKind.EMPTY_RESPONSE, "Website returned empty response: " + base.url());
        }
        ContentExtractionOptions opts = (options != null) ? options : ContentExtractionOptions.defaults();
        opts.validate();

        Document source = Jsoup.parse(html, base.url());
        Element root;
        try {
            root = filter(source, opts);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            // 괄호 불균형 등은 jsoup Validate에서 IllegalArgumentException으로 올라온다
            throw new ExtractionException(ErrorKind.INVALID_SELECTOR, "Invalid selector: " + e.getMessage(), e);
        }

        String out = render(source, root, opts);
        LOG.debug("content extracted: url={}, format={}, chars={}", base.url(), opts.getOutputFormat(), out.length());
        return out;
    }

    /** 필터링된 작업 트리의 루트(body 또는 include 컨테이너를 감싼 body) */
    Element filter(Document source, ContentExtractionOptions opts) {
        Element working = Jsoup.parseBodyFragment(source.body().html(), source.location()).body();

        List<String> include = opts.getIncludeElements();
        if (!include.isEmpty()) {
            Document filtered = Jsoup.parseBodyFragment("<div></div>", source.location());
            Element container = filtered.body().child(0);
            for (String selector : include) {
                for (Element el : working.select(selector)) {
                    container.appendChild(el.clone());
                }
            }
            if (container.childrenSize() > 0) {
                working = filtered.body();
            }
        }

        for (String selector : opts.getExcludeElements()) {
            working.select(selector).remove();
        }
        working.select("script, style, noscript").remove();

        if (opts.isIgnoreLinks()) {
            for (Element a : working.select("a")) {
                a.replaceWith(new TextNode(a.text()));
            }
        }
        return working;
    }

    private String render(Document source, Element root, ContentExtractionOptions opts) {
        switch (opts.getOutputFormat()) {
            case TEXT:
                return root.text().trim();
            case HTML:
                return opts.isTextOnly() ? root.text() : root.html();
            case JSON:
                return json(source, root);
            case MARKDOWN:
            default:
                return new MarkdownConverter(opts.isIgnoreLinks(), opts.isTextOnly()).convert(root);
        }
    }

    private static String json(Document source, Element root) {
        Element title = source.selectFirst("title");
        ObjectNode node = MAPPER.createObjectNode();
        node.put("title", title != null ? title.text() : "");
        node.put("content", root.text());
        node.put("html", root.html());
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
