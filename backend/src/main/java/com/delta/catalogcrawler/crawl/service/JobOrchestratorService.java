package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.error.JobNotFoundException;
import com.delta.catalogcrawler.crawl.error.ResourceExhaustionException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.CrawlRequest;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.JobStatusResponse;
import com.delta.catalogcrawler.crawl.persistence.AsyncStoreWriter;
import com.delta.catalogcrawler.crawl.persistence.CrawlStore;
import com.delta.catalogcrawler.crawl.queue.JobCoordinator;
import com.delta.catalogcrawler.crawl.queue.QueueWorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Public entry point for crawl jobs: accepts requests, answers status queries and cancels jobs.
 */
@Service
public class JobOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestratorService.class);
    private static final int MIN_PRIORITY = 1;
    private static final int MAX_PRIORITY = 10;

    private final DomainPolicyService domainPolicyService;
    private final JobRegistry registry;
    private final QueueWorkerService queueWorkerService;
    private final JobCoordinator coordinator;
    private final AsyncStoreWriter writer;
    private final CrawlStore store;
    private final CrawlerProperties properties;

    public JobOrchestratorService(
        DomainPolicyService domainPolicyService,
        JobRegistry registry,
        QueueWorkerService queueWorkerService,
        JobCoordinator coordinator,
        AsyncStoreWriter writer,
        CrawlStore store,
        CrawlerProperties properties
    ) {
        this.domainPolicyService = domainPolicyService;
        this.registry = registry;
        this.queueWorkerService = queueWorkerService;
        this.coordinator = coordinator;
        this.writer = writer;
        this.store = store;
        this.properties = properties;
    }

    /**
     * Validates the request and queues the job's root page, plus the site's sitemap when sitemap seeding is on.
     *
     * @return the new job id
     * @throws InvalidRequestException for a malformed URL, a disallowed domain or out-of-range limits
     * @throws ResourceExhaustionException when the store cannot keep up with writes
     */
    public String enqueueCrawl(CrawlRequest request) {
        if (request == null) {
            throw new InvalidRequestException("missing_request", "request body is required");
        }
        String rootUrl = domainPolicyService.validateRootUrl(request.rootUrl());
        String domain = domainPolicyService.resolveDomain(rootUrl, request.domain());
        ConcurrencyClass concurrencyClass = domainPolicyService.resolveConcurrencyClass(domain, request.concurrencyClass());
        int maxPages = resolveMaxPages(request.maxPages());
        int priority = resolvePriority(request.priority());
        int timeoutSeconds = resolveTimeoutSeconds(request.timeoutSeconds());

        if (writer.isSaturated() && !writer.awaitCapacity(properties.getPersistence().getBackpressureWaitMs())) {
            log.warn("Rejecting job for domain={} pendingWrites={}", domain, writer.pendingWrites());
            throw new ResourceExhaustionException("persistence_backpressure", "storage is saturated, retry later");
        }

        Instant now = Instant.now();
        CrawlJob job = new CrawlJob(
            UUID.randomUUID().toString(),
            rootUrl,
            domain,
            concurrencyClass,
            maxPages,
            request.followPaginationOrDefault(),
            request.followProductLinksOrDefault(),
            priority,
            timeoutSeconds,
            properties.getPagination().getStallPageLimit(),
            now,
            now.plusSeconds(timeoutSeconds)
        );
        queueWorkerService.submitJob(job, request.useSitemapOr(properties.getSitemap().isEnabledByDefault()));
        return job.getId();
    }

    public JobStatusResponse getJobStatus(String jobId) {
        Optional<CrawlJob> live = registry.find(jobId);
        if (live.isPresent()) {
            return live.get().toStatusResponse();
        }
        JobSnapshot snapshot = store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return new JobStatusResponse(
            snapshot.jobId(),
            snapshot.domain(),
            snapshot.concurrencyClass(),
            snapshot.status(),
            snapshot.pagesVisited(),
            snapshot.productsFound(),
            snapshot.errorCount(),
            List.of(),
            snapshot.createdAt(),
            snapshot.finishedAt()
        );
    }

    /**
     * Stops scheduling new tasks for the job. Tasks already running finish first.
     */
    public JobStatusResponse cancelJob(String jobId) {
        CrawlJob job = registry.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.isTerminal()) {
            coordinator.cancel(job);
        }
        return job.toStatusResponse();
    }

    private int resolveMaxPages(Integer requested) {
        CrawlerProperties.Job config = properties.getJob();
        if (requested == null) {
            return config.getDefaultMaxPages();
        }
        if (requested < 1) {
            throw new InvalidRequestException("invalid_max_pages", "maxPages must be at least 1");
        }
        return Math.min(requested, config.getMaxPagesCap());
    }

    private int resolvePriority(Integer requested) {
        if (requested == null) {
            return properties.getJob().getDefaultPriority();
        }
        if (requested < MIN_PRIORITY || requested > MAX_PRIORITY) {
            throw new InvalidRequestException("invalid_priority", "priority must be between 1 and 10");
        }
        return requested;
    }

    private int resolveTimeoutSeconds(Integer requested) {
        if (requested == null) {
            return properties.getJob().getDefaultTimeoutSeconds();
        }
        if (requested < 1) {
            throw new InvalidRequestException("invalid_timeout", "timeoutSeconds must be positive");
        }
        return requested;
    }
}
