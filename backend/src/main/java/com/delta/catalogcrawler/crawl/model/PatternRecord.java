package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

/**
 * Learned strategy for a (domain, page type) pair. {@code version} increases on every accepted update.
 */
public record PatternRecord(
    String domain,
    PageType pageType,
    ExtractionStrategy strategy,
    double confidence,
    int consecutiveFailures,
    long successCount,
    long failureCount,
    long version,
    Instant lastValidatedAt,
    boolean invalidated
) {
    public PatternKey key() {
        return new PatternKey(domain, pageType);
    }
}
