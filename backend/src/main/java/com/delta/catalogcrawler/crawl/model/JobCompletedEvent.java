package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record JobCompletedEvent(
    String jobId,
    String domain,
    JobStatus status,
    int pagesVisited,
    int productsFound,
    int errorCount,
    Instant finishedAt
) {
}
