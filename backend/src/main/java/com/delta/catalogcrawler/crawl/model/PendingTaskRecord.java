package com.delta.catalogcrawler.crawl.model;

public record PendingTaskRecord(
    String jobId,
    String url,
    FetchTaskKind kind,
    int priority,
    int attempts
) {
}
