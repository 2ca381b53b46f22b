package com.delta.catalogcrawler.crawl.model;

public enum FetchTaskKind {
    ROOT,
    PAGINATION,
    PRODUCT_DETAIL,
    SITEMAP,
    SITEMAP_ENTRY
}
