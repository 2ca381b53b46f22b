package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record JobStatusResponse(
    String jobId,
    String domain,
    ConcurrencyClass concurrencyClass,
    JobStatus state,
    int pagesVisited,
    int productsFound,
    int errorCount,
    List<FailureLedgerEntry> errors,
    Instant createdAt,
    Instant finishedAt
) {
}
