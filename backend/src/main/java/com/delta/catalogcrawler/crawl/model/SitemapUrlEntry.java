package com.delta.catalogcrawler.crawl.model;

public record SitemapUrlEntry(String url, String lastmod) {
}
