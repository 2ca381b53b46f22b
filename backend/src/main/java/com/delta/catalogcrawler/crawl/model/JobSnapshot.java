package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record JobSnapshot(
    String jobId,
    String rootUrl,
    String domain,
    ConcurrencyClass concurrencyClass,
    int maxPages,
    boolean followPagination,
    boolean followProductLinks,
    int priority,
    int timeoutSeconds,
    JobStatus status,
    int pagesVisited,
    int productsFound,
    int errorCount,
    Instant createdAt,
    Instant finishedAt
) {
}
