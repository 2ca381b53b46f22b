package com.delta.catalogcrawler.crawl.model;

import java.time.LocalDate;
import java.util.List;

public record ExtractionResult(
    String url,
    PageType pageType,
    Platform platform,
    String title,
    String cleanedText,
    List<String> images,
    LocalDate publishedDate,
    String contentHash,
    ExtractionStrategy strategy,
    double confidence,
    boolean lowQuality,
    List<RawProduct> products,
    PaginationHint pagination,
    List<String> breadcrumbs,
    Integer totalProducts,
    List<String> productLinks
) {
    public ExtractionResult {
        images = images == null ? List.of() : List.copyOf(images);
        products = products == null ? List.of() : List.copyOf(products);
        pagination = pagination == null ? PaginationHint.none() : pagination;
        breadcrumbs = breadcrumbs == null ? List.of() : List.copyOf(breadcrumbs);
        productLinks = productLinks == null ? List.of() : List.copyOf(productLinks);
    }

    public static ExtractionResult fromContent(
        String url,
        PageType pageType,
        Platform platform,
        ContentExtraction content,
        PaginationHint pagination
    ) {
        return new ExtractionResult(
            url,
            pageType,
            platform,
            content.title(),
            content.cleanedText(),
            content.images(),
            content.publishedDate(),
            content.contentHash(),
            ExtractionStrategy.BASE_CONTENT,
            content.lowQuality() ? 0.2 : 0.5,
            content.lowQuality(),
            List.of(),
            pagination,
            List.of(),
            null,
            List.of()
        );
    }
}
