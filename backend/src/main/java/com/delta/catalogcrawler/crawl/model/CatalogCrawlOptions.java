package com.delta.catalogcrawler.crawl.model;

public record CatalogCrawlOptions(int maxPages, boolean followPagination) {
    public CatalogCrawlOptions {
        maxPages = Math.max(1, maxPages);
    }
}
