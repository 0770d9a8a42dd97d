package com.pagelens.core.extract;

import com.pagelens.core.api.ErrorKind;
import com.pagelens.core.api.ExtractionException;
import com.pagelens.core.api.IPageExtractor;
import com.pagelens.core.model.ExtractedDocument;
import com.pagelens.core.model.ExtractorConfig;
import com.pagelens.core.model.NormalizedUrl;
import com.pagelens.core.robots.HttpRobotsFetcher;
import com.pagelens.core.robots.RobotsClock;
import com.pagelens.core.robots.RobotsRepository;
import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.UrlResolver;

import java.time.Duration;
import java.util.Objects;

/**
 * HTML + 원본 URL → ExtractedDocument.
 * URL 검증 → 1회 파싱 → 추출기 실행 → robots.txt 첨부(best-effort).
 * 결과는 문서 또는 ExtractionException 중 하나(부분 성공 없음).
 */
public final class PageExtractor implements IPageExtractor {
    private static final StructuredLog SLOG = StructuredLog.get(PageExtractor.class);

    private final DocumentAssembler assembler;
    private final RobotsRepository robots; // null이면 robots.txt 미첨부

    /** 기본 구성: robots.fetch 설정에 따라 HTTP 로더 사용 */
    public PageExtractor(ExtractorConfig config) {
        this(new DocumentAssembler(validated(config)), defaultRobots(config));
    }

    /** DI/테스트용. robots는 null 허용 */
    public PageExtractor(DocumentAssembler assembler, RobotsRepository robots) {
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.robots = robots;
    }

    @Override
    public ExtractedDocument extract(String html, String sourceUrl) throws ExtractionException {
        NormalizedUrl base = UrlResolver.normalize(sourceUrl);
        if (html == null || html.isBlank()) {
            throw new ExtractionException(ErrorKind.EMPTY_RESPONSE, "Empty HTML for " + base.url());
        }

        long t0 = System.nanoTime();
        PageContext ctx = PageContext.parse(html, base);
        String robotsTxt = (robots == null) ? null : robots.robotsTxtFor(base.uri()).orElse(null);
        ExtractedDocument doc = assembler.assemble(ctx, robotsTxt, html);

        SLOG.info("extract.done",
                "url", base.url(),
                "ms", (System.nanoTime() - t0) / 1_000_000L,
                "headings", doc.getHeadings().size(),
                "links", doc.getLinks().size(),
                "images", doc.getImages().size(),
                "videos", doc.getVideos().size(),
                "fonts", doc.getFonts().size(),
                "colors", doc.getColors().size(),
                "emails", doc.getEmails().size(),
                "phones", doc.getPhoneNumbers().size(),
                "robots", robotsTxt != null);
        return doc;
    }

    private static ExtractorConfig validated(ExtractorConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    private static RobotsRepository defaultRobots(ExtractorConfig config) {
        ExtractorConfig.RobotsCfg rc = config.getRobots();
        if (!rc.isFetch()) return null;
        Duration ttl = Duration.ofMinutes(rc.getCacheTtlMinutes());
        return new RobotsRepository(
                new HttpRobotsFetcher(rc.timeout(), config.getUserAgent()),
                RobotsClock.SYSTEM,
                ttl,
                ttl.compareTo(RobotsRepository.DEFAULT_FAILURE_TTL) < 0 ? ttl : RobotsRepository.DEFAULT_FAILURE_TTL);
    }
}
