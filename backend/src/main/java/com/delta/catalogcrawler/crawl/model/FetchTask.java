package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

/**
 * One fetch-and-extract unit of a job. State fields are only changed by the task queue and the worker
 * holding the task.
 */
public class FetchTask {
    private final long sequence;
    private final String jobId;
    private final String url;
    private final FetchTaskKind kind;
    private final int priority;
    private final ConcurrencyClass concurrencyClass;
    private final Instant enqueuedAt;

    private volatile TaskState state = TaskState.PENDING;
    private volatile int attempts;
    private volatile Instant notBefore;
    private volatile String lastReasonCode;

    public FetchTask(
        long sequence,
        String jobId,
        String url,
        FetchTaskKind kind,
        int priority,
        ConcurrencyClass concurrencyClass,
        Instant enqueuedAt,
        int attempts
    ) {
        this.sequence = sequence;
        this.jobId = jobId;
        this.url = url;
        this.kind = kind;
        this.priority = priority;
        this.concurrencyClass = concurrencyClass;
        this.enqueuedAt = enqueuedAt;
        this.attempts = Math.max(0, attempts);
        this.notBefore = enqueuedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public String getJobId() {
        return jobId;
    }

    public String getUrl() {
        return url;
    }

    public FetchTaskKind getKind() {
        return kind;
    }

    public int getPriority() {
        return priority;
    }

    public ConcurrencyClass getConcurrencyClass() {
        return concurrencyClass;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public TaskState getState() {
        return state;
    }

    public void setState(TaskState state) {
        this.state = state;
    }

    public int getAttempts() {
        return attempts;
    }

    public int incrementAttempts() {
        attempts = attempts + 1;
        return attempts;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public void setNotBefore(Instant notBefore) {
        this.notBefore = notBefore;
    }

    public String getLastReasonCode() {
        return lastReasonCode;
    }

    public void setLastReasonCode(String lastReasonCode) {
        this.lastReasonCode = lastReasonCode;
    }

    public boolean isReady(Instant now) {
        return state == TaskState.PENDING && (notBefore == null || !notBefore.isAfter(now));
    }

    public PendingTaskRecord toPendingRecord() {
        return new PendingTaskRecord(jobId, url, kind, priority, attempts);
    }

    @Override
    public String toString() {
        return "FetchTask{jobId=" + jobId + ", url=" + url + ", kind=" + kind + ", priority=" + priority
            + ", state=" + state + ", attempts=" + attempts + "}";
    }
}
