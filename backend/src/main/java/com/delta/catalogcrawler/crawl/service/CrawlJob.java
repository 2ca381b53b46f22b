package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.FailureLedgerEntry;
import com.delta.catalogcrawler.crawl.model.JobCompletedEvent;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.JobStatus;
import com.delta.catalogcrawler.crawl.model.JobStatusResponse;
import com.delta.catalogcrawler.crawl.pagination.CatalogTraversal;
import com.delta.catalogcrawler.crawl.pagination.ProductDeduplicator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live state of one crawl job. Workers update it concurrently; status transitions go through
 * compare-and-set so a job reaches exactly one terminal state.
 */
public class CrawlJob {
    private static final int MAX_LEDGER_ENTRIES = 1000;

    private final String id;
    private final String rootUrl;
    private final String domain;
    private final ConcurrencyClass concurrencyClass;
    private final int maxPages;
    private final boolean followPagination;
    private final boolean followProductLinks;
    private final int priority;
    private final int timeoutSeconds;
    private final Instant createdAt;
    private final Instant deadline;

    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.QUEUED);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean completionPublished = new AtomicBoolean(false);
    private final AtomicInteger pagesVisited = new AtomicInteger();
    private final AtomicInteger pagesScheduled = new AtomicInteger();
    private final AtomicInteger outstandingTasks = new AtomicInteger();
    private final AtomicInteger resolvedTasks = new AtomicInteger();
    private final AtomicInteger failedTasks = new AtomicInteger();
    private final AtomicInteger unchangedPages = new AtomicInteger();
    private final Set<String> seenUrls = ConcurrentHashMap.newKeySet();
    private final Set<String> savedContentHashes = ConcurrentHashMap.newKeySet();
    private final List<FailureLedgerEntry> ledger = new ArrayList<>();
    private final ProductDeduplicator products = new ProductDeduplicator();
    private final CatalogTraversal traversal;

    private volatile Instant finishedAt;
    private volatile boolean timedOut;
    private volatile String systemicFailure;

    public CrawlJob(
        String id,
        String rootUrl,
        String domain,
        ConcurrencyClass concurrencyClass,
        int maxPages,
        boolean followPagination,
        boolean followProductLinks,
        int priority,
        int timeoutSeconds,
        int stallPageLimit,
        Instant createdAt,
        Instant deadline
    ) {
        this.id = id;
        this.rootUrl = rootUrl;
        this.domain = domain;
        this.concurrencyClass = concurrencyClass;
        this.maxPages = maxPages;
        this.followPagination = followPagination;
        this.followProductLinks = followProductLinks;
        this.priority = priority;
        this.timeoutSeconds = timeoutSeconds;
        this.createdAt = createdAt;
        this.deadline = deadline;
        this.traversal = new CatalogTraversal(maxPages, followPagination, stallPageLimit, domain);
    }

    public String getId() {
        return id;
    }

    public String getRootUrl() {
        return rootUrl;
    }

    public String getDomain() {
        return domain;
    }

    public ConcurrencyClass getConcurrencyClass() {
        return concurrencyClass;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public boolean isFollowPagination() {
        return followPagination;
    }

    public boolean isFollowProductLinks() {
        return followProductLinks;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public JobStatus getStatus() {
        return status.get();
    }

    public CatalogTraversal getTraversal() {
        return traversal;
    }

    public ProductDeduplicator getProducts() {
        return products;
    }

    public boolean markRunning() {
        return status.compareAndSet(JobStatus.QUEUED, JobStatus.RUNNING);
    }

    public boolean isTerminal() {
        return status.get().isTerminal();
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Whether new tasks may still be scheduled for this job.
     */
    public boolean isAcceptingTasks() {
        return !cancelRequested.get() && !timedOut && systemicFailure == null && !isTerminal();
    }

    /**
     * Claims a page slot for {@code normalizedUrl}: false when the URL was already claimed or the page budget is spent.
     */
    public boolean claimPage(String normalizedUrl) {
        if (normalizedUrl == null || seenUrls.contains(normalizedUrl)) {
            return false;
        }
        if (pagesScheduled.incrementAndGet() > maxPages) {
            pagesScheduled.decrementAndGet();
            return false;
        }
        if (!seenUrls.add(normalizedUrl)) {
            pagesScheduled.decrementAndGet();
            return false;
        }
        return true;
    }

    /**
     * Marks a non-page document (a sitemap) as seen without taking a page slot.
     */
    public boolean claimAuxiliary(String normalizedUrl) {
        return normalizedUrl != null && seenUrls.add(normalizedUrl);
    }

    /**
     * Returns a page slot claimed for a task that was never queued (a new job refused by closed intake).
     */
    public void releasePage(String normalizedUrl) {
        if (seenUrls.remove(normalizedUrl)) {
            pagesScheduled.decrementAndGet();
        }
    }

    public boolean hasSeen(String normalizedUrl) {
        return seenUrls.contains(normalizedUrl);
    }

    public void taskScheduled() {
        outstandingTasks.incrementAndGet();
    }

    public void taskResolved(boolean failed) {
        resolvedTasks.incrementAndGet();
        if (failed) {
            failedTasks.incrementAndGet();
        }
        outstandingTasks.decrementAndGet();
    }

    /**
     * Resolves a task that fetched no catalog page; it counts toward neither pages nor the error ratio.
     */
    public void auxiliaryTaskResolved() {
        outstandingTasks.decrementAndGet();
    }

    /**
     * Drops tasks removed from the queue without running them (cancellation, timeout).
     */
    public void tasksDropped(int count) {
        outstandingTasks.addAndGet(-count);
    }

    public int outstandingTasks() {
        return outstandingTasks.get();
    }

    /**
     * Carries progress over from a job restored after a restart.
     */
    public void restoreProgress(int visited) {
        pagesVisited.set(visited);
        pagesScheduled.set(visited);
    }

    public void pageVisited() {
        pagesVisited.incrementAndGet();
    }

    /**
     * @return true the first time this content hash is seen in the job
     */
    public boolean markContentSaved(String contentHash) {
        return contentHash == null || savedContentHashes.add(contentHash);
    }

    /**
     * A page whose content matches what an earlier crawl stored.
     */
    public void pageUnchanged() {
        unchangedPages.incrementAndGet();
    }

    public int getUnchangedPages() {
        return unchangedPages.get();
    }

    public void record(FailureLedgerEntry entry) {
        synchronized (ledger) {
            if (ledger.size() < MAX_LEDGER_ENTRIES) {
                ledger.add(entry);
            }
        }
    }

    public List<FailureLedgerEntry> ledger() {
        synchronized (ledger) {
            return List.copyOf(ledger);
        }
    }

    public int errorCount() {
        return failedTasks.get();
    }

    public double errorRatio() {
        int resolved = resolvedTasks.get();
        return resolved == 0 ? 0.0 : (double) failedTasks.get() / resolved;
    }

    public void markTimedOut() {
        timedOut = true;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public void markSystemicFailure(String reason) {
        if (systemicFailure == null) {
            systemicFailure = reason;
        }
    }

    public String getSystemicFailure() {
        return systemicFailure;
    }

    /**
     * Moves the job to {@code terminal} unless it already reached a terminal state.
     */
    public boolean finish(JobStatus terminal, Instant when) {
        while (true) {
            JobStatus current = status.get();
            if (current.isTerminal()) {
                return false;
            }
            if (status.compareAndSet(current, terminal)) {
                finishedAt = when;
                return true;
            }
        }
    }

    /**
     * @return true exactly once per job
     */
    public boolean claimCompletionEvent() {
        return completionPublished.compareAndSet(false, true);
    }

    public JobSnapshot toSnapshot() {
        return new JobSnapshot(
            id, rootUrl, domain, concurrencyClass, maxPages, followPagination, followProductLinks, priority,
            timeoutSeconds, status.get(), pagesVisited.get(), products.size(), failedTasks.get(), createdAt, finishedAt
        );
    }

    public JobStatusResponse toStatusResponse() {
        return new JobStatusResponse(
            id, domain, concurrencyClass, status.get(), pagesVisited.get(), products.size(), failedTasks.get(),
            ledger(), createdAt, finishedAt
        );
    }

    public JobCompletedEvent toCompletedEvent() {
        return new JobCompletedEvent(id, domain, status.get(), pagesVisited.get(), products.size(), failedTasks.get(), finishedAt);
    }
}
