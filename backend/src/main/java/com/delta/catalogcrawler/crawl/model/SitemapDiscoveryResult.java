package com.delta.catalogcrawler.crawl.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of walking a site's sitemaps: the sitemap documents read, the page URLs they listed (first seen wins)
 * and error counts keyed by reason.
 */
public record SitemapDiscoveryResult(
    List<String> fetchedSitemaps,
    List<SitemapUrlEntry> entries,
    Map<String, Integer> errors
) {
}
