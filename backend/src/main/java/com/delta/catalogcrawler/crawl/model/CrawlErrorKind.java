package com.delta.catalogcrawler.crawl.model;

public enum CrawlErrorKind {
    INVALID_REQUEST(false, true),
    TRANSIENT_FETCH(true, false),
    TERMINAL_FETCH(false, true),
    EXTRACTION_LOW_CONFIDENCE(false, false),
    NORMALIZATION_AMBIGUOUS(false, false),
    RESOURCE_EXHAUSTION(true, false),
    JOB_TIMEOUT(false, false),
    SITEMAP_UNAVAILABLE(false, false);

    private final boolean retryable;
    private final boolean taskFailure;

    CrawlErrorKind(boolean retryable, boolean taskFailure) {
        this.retryable = retryable;
        this.taskFailure = taskFailure;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether a ledger entry of this kind counts toward the job's task error ratio.
     */
    public boolean isTaskFailure() {
        return taskFailure;
    }
}
