package com.delta.catalogcrawler.crawl.api;

public record CatalogCrawlApiRequest(
    String startUrl,
    Integer maxPages,
    Boolean followPagination
) {
}
