package com.delta.catalogcrawler.crawl.model;

public record QueueStatusResponse(
    boolean running,
    int activeWorkers,
    int pendingTasks,
    int inFlightTasks,
    int activeJobs,
    int workerRestarts,
    int pendingWrites
) {
}
