package com.delta.catalogcrawler.crawl.model;

public record CrawlRequest(
    String rootUrl,
    String domain,
    Integer maxPages,
    ConcurrencyClass concurrencyClass,
    Boolean followPagination,
    Boolean followProductLinks,
    Integer priority,
    Integer timeoutSeconds,
    Boolean useSitemap
) {
    public static CrawlRequest of(String rootUrl, int maxPages, boolean followPagination) {
        return new CrawlRequest(rootUrl, null, maxPages, null, followPagination, true, null, null, null);
    }

    public boolean followPaginationOrDefault() {
        return followPagination == null || followPagination;
    }

    public boolean useSitemapOr(boolean defaultValue) {
        return useSitemap == null ? defaultValue : useSitemap;
    }

    public boolean followProductLinksOrDefault() {
        return followProductLinks == null || followProductLinks;
    }
}
