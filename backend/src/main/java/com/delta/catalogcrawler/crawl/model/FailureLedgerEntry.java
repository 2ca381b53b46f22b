package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record FailureLedgerEntry(
    String url,
    CrawlErrorKind kind,
    String reasonCode,
    String message,
    int attempts,
    Instant recordedAt
) {
}
