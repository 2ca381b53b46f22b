package com.delta.catalogcrawler.crawl.model;

public enum TaskState {
    PENDING,
    IN_FLIGHT,
    DONE,
    FAILED_RETRYABLE,
    FAILED_TERMINAL;

    public boolean isResolved() {
        return this == DONE || this == FAILED_TERMINAL;
    }
}
