package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.events.JobEventPublisher;
import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.model.FailureLedgerEntry;
import com.delta.catalogcrawler.crawl.model.FetchTask;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.JobStatus;
import com.delta.catalogcrawler.crawl.persistence.AsyncStoreWriter;
import com.delta.catalogcrawler.crawl.persistence.CrawlStore;
import com.delta.catalogcrawler.crawl.service.CrawlJob;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Job-level bookkeeping shared by the orchestrator and the workers: scheduling tasks within a job's budget,
 * deciding the final status and publishing the completion event.
 */
@Service
public class JobCoordinator {
    private static final Logger log = LoggerFactory.getLogger(JobCoordinator.class);

    private final FetchTaskQueue queue;
    private final AsyncStoreWriter writer;
    private final CrawlStore store;
    private final JobEventPublisher eventPublisher;
    private final CrawlerProperties properties;

    public JobCoordinator(
        FetchTaskQueue queue,
        AsyncStoreWriter writer,
        CrawlStore store,
        JobEventPublisher eventPublisher,
        CrawlerProperties properties
    ) {
        this.queue = queue;
        this.writer = writer;
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /**
     * Queues {@code url} for the job when it is inside the job's domain, not yet seen and within the page budget.
     * Discovered links are held back while the store writer is saturated.
     *
     * @return true when a new task was queued
     */
    public boolean schedule(CrawlJob job, String url, FetchTaskKind kind, int attempts) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null || !job.isAcceptingTasks()) {
            return false;
        }
        if (!UrlNormalizer.isWithinDomain(UrlNormalizer.hostOf(normalized), job.getDomain())) {
            log.debug("Skipping off-domain link jobId={} url={}", job.getId(), normalized);
            return false;
        }
        if (!job.claimPage(normalized)) {
            return false;
        }
        long delayMs = kind != FetchTaskKind.ROOT && writer.isSaturated()
            ? properties.getPersistence().getBackpressureWaitMs()
            : 0;
        job.taskScheduled();
        FetchTaskQueue.Submitted submitted = queue.submit(
            job.getId(), normalized, kind, job.getPriority(), job.getConcurrencyClass(), attempts, delayMs
        );
        if (submitted == null || !submitted.created()) {
            job.tasksDropped(1);
            if (submitted == null) {
                job.releasePage(normalized);
            }
            return false;
        }
        return true;
    }

    /**
     * Queues the site's /sitemap.xml. The sitemap document itself does not use a page slot.
     */
    public boolean scheduleSitemap(CrawlJob job) {
        URI root = UrlNormalizer.safeUri(job.getRootUrl());
        if (root == null || root.getHost() == null || !job.isAcceptingTasks()) {
            return false;
        }
        String sitemapUrl = UrlNormalizer.normalize(root.getScheme() + "://" + root.getRawAuthority() + "/sitemap.xml");
        if (!job.claimAuxiliary(sitemapUrl)) {
            return false;
        }
        job.taskScheduled();
        FetchTaskQueue.Submitted submitted = queue.submit(
            job.getId(), sitemapUrl, FetchTaskKind.SITEMAP, job.getPriority(), job.getConcurrencyClass(), 0, 0
        );
        if (submitted == null || !submitted.created()) {
            job.tasksDropped(1);
            return false;
        }
        return true;
    }

    public void start(CrawlJob job) {
        if (job.markRunning()) {
            persistSnapshot(job);
            log.info("Job running jobId={} domain={} class={} maxPages={}",
                job.getId(), job.getDomain(), job.getConcurrencyClass(), job.getMaxPages());
        }
    }

    public void recordFailure(CrawlJob job, FetchTask task, CrawlErrorKind kind, String reasonCode, String message) {
        job.record(new FailureLedgerEntry(task.getUrl(), kind, reasonCode, message, task.getAttempts(), Instant.now()));
    }

    public void recordNote(CrawlJob job, String url, CrawlErrorKind kind, String reasonCode, String message) {
        job.record(new FailureLedgerEntry(url, kind, reasonCode, message, 0, Instant.now()));
    }

    /**
     * Finishes the job once no task is outstanding.
     */
    public void finishIfDone(CrawlJob job) {
        if (job.isTerminal() || job.outstandingTasks() > 0) {
            return;
        }
        complete(job, decideStatus(job));
    }

    public void cancel(CrawlJob job) {
        job.requestCancel();
        dropPending(job);
        log.info("Job cancel requested jobId={} inFlight={}", job.getId(), queue.inFlightCount(job.getId()));
        finishIfDone(job);
    }

    /**
     * Ends a job past its deadline: pending tasks are dropped and the job finishes right away. Tasks already
     * in flight run to completion but no longer change the outcome.
     */
    public boolean expireIfOverdue(CrawlJob job, Instant now) {
        if (job.isTerminal() || job.isTimedOut() || !now.isAfter(job.getDeadline())) {
            return false;
        }
        job.markTimedOut();
        int dropped = dropPending(job);
        job.record(new FailureLedgerEntry(
            job.getRootUrl(), CrawlErrorKind.JOB_TIMEOUT, "job_timeout",
            "job exceeded its deadline; " + dropped + " pending tasks cancelled", 0, now
        ));
        log.warn("Job timed out jobId={} droppedTasks={} inFlight={}", job.getId(), dropped, queue.inFlightCount(job.getId()));
        complete(job, decideStatus(job));
        return true;
    }

    public void failSystemic(CrawlJob job, String reason, Throwable cause) {
        if (job.isTerminal()) {
            return;
        }
        job.markSystemicFailure(reason);
        dropPending(job);
        log.warn("Job failed on systemic error jobId={} reason={}", job.getId(), reason, cause);
        complete(job, JobStatus.FAILED);
    }

    public void persistSnapshot(CrawlJob job) {
        persist(job, "job " + job.getId(), () -> store.saveJob(job.toSnapshot()));
    }

    /**
     * Queues a store write for the job. A write that fails ends the job as FAILED.
     */
    public void persist(CrawlJob job, String label, Runnable write) {
        writer.write(label, write).whenComplete((ignored, error) -> {
            if (error != null) {
                failSystemic(job, "persistence_unavailable", error);
            }
        });
    }

    JobStatus decideStatus(CrawlJob job) {
        if (job.getSystemicFailure() != null) {
            return JobStatus.FAILED;
        }
        if (job.isCancelRequested()) {
            return JobStatus.CANCELLED;
        }
        if (job.errorRatio() > properties.getQueue().getErrorRatioThreshold()) {
            return JobStatus.FAILED;
        }
        if (job.errorCount() > 0 || job.isTimedOut()) {
            return JobStatus.PARTIAL;
        }
        return JobStatus.COMPLETED;
    }

    private int dropPending(CrawlJob job) {
        List<FetchTask> removed = queue.removeJob(job.getId());
        job.tasksDropped(removed.size());
        return removed.size();
    }

    private void complete(CrawlJob job, JobStatus status) {
        if (!job.finish(status, Instant.now())) {
            return;
        }
        queue.forgetJob(job.getId());
        persistSnapshot(job);
        if (job.claimCompletionEvent()) {
            try {
                eventPublisher.publish(job.toCompletedEvent());
            } catch (RuntimeException e) {
                log.warn("Completion event delivery failed jobId={}", job.getId(), e);
            }
        }
    }
}
