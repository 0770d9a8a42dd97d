package com.pagelens.core.extract;

import com.pagelens.core.extract.lexical.EmailExtractor;
import com.pagelens.core.extract.lexical.LibPhoneNumberDetector;
import com.pagelens.core.extract.lexical.PhoneNumberExtractor;
import com.pagelens.core.extract.structure.HeadingExtractor;
import com.pagelens.core.extract.structure.ImageExtractor;
import com.pagelens.core.extract.structure.LinkExtractor;
import com.pagelens.core.extract.structure.MetadataExtractor;
import com.pagelens.core.extract.structure.PageMetadata;
import com.pagelens.core.extract.structure.video.VideoExtractor;
import com.pagelens.core.extract.style.ColorExtractor;
import com.pagelens.core.extract.style.FontExtractor;
import com.pagelens.core.model.ExtractedDocument;
import com.pagelens.core.model.ExtractorConfig;

import java.util.Objects;

/**
 * 구조/어휘/스타일 추출기를 하나의 PageContext 위에서 실행하고 결과 레코드를 만든다.
 * 추출기 간 공유 상태 없음. 각 추출기가 자체 중복 제거/정렬을 끝낸 값을 그대로 조립한다.
 */
public final class DocumentAssembler {

    private final MetadataExtractor metadata;
    private final HeadingExtractor headings;
    private final LinkExtractor links;
    private final ImageExtractor images;
    private final VideoExtractor videos;
    private final EmailExtractor emails;
    private final PhoneNumberExtractor phones;
    private final FontExtractor fonts;
    private final ColorExtractor colors;

    /** 기본 구성 */
    public DocumentAssembler(ExtractorConfig config) {
        this(new MetadataExtractor(),
             new HeadingExtractor(),
             new LinkExtractor(),
             new ImageExtractor(),
             new VideoExtractor(),
             new EmailExtractor(),
             new PhoneNumberExtractor(new LibPhoneNumberDetector(), config.getPhoneDefaultRegion()),
             new FontExtractor(),
             new ColorExtractor(config.getMaxColors()));
    }

    /** DI/테스트용 */
    public DocumentAssembler(MetadataExtractor metadata,
                             HeadingExtractor headings,
                             LinkExtractor links,
                             ImageExtractor images,
                             VideoExtractor videos,
                             EmailExtractor emails,
                             PhoneNumberExtractor phones,
                             FontExtractor fonts,
                             ColorExtractor colors) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.headings = Objects.requireNonNull(headings, "headings");
        this.links = Objects.requireNonNull(links, "links");
        this.images = Objects.requireNonNull(images, "images");
        this.videos = Objects.requireNonNull(videos, "videos");
        this.emails = Objects.requireNonNull(emails, "emails");
        this.phones = Objects.requireNonNull(phones, "phones");
        this.fonts = Objects.requireNonNull(fonts, "fonts");
        this.colors = Objects.requireNonNull(colors, "colors");
    }

    /**
     * @param robotsTxt best-effort로 가져온 robots.txt 본문(없으면 null)
     * @param html      추출에 사용한 원본 HTML(레코드에 그대로 보관)
     */
    public ExtractedDocument assemble(PageContext ctx, String robotsTxt, String html) {
        PageMetadata meta = metadata.extract(ctx);

        return ExtractedDocument.builder()
                .sourceUrl(ctx.baseUrl().url())
                .title(meta.title())
                .description(meta.description())
                .ogImage(meta.ogImage())
                .favicon(meta.favicon())
                .metaTags(meta.metaTags())
                .scripts(meta.scripts())
                .stylesheets(meta.stylesheets())
                .textContent(meta.textContent())
                .headings(headings.extract(ctx))
                .links(links.extract(ctx))
                .images(images.extract(ctx))
                .videos(videos.extract(ctx))
                .emails(emails.extract(ctx))
                .phoneNumbers(phones.extract(ctx))
                .fonts(fonts.extract(ctx))
                .colors(colors.extract(ctx))
                .robotsTxt(robotsTxt)
                .html(html)
                .build();
    }
}
