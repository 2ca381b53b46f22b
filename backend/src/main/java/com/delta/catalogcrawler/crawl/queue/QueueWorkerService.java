package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.ResourceExhaustionException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.FetchTask;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.PendingTaskRecord;
import com.delta.catalogcrawler.crawl.model.QueueStatusResponse;
import com.delta.catalogcrawler.crawl.persistence.AsyncStoreWriter;
import com.delta.catalogcrawler.crawl.persistence.CrawlStore;
import com.delta.catalogcrawler.crawl.service.CrawlJob;
import com.delta.catalogcrawler.crawl.service.JobRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the worker pool against the fetch queue and the periodic housekeeping around it: job deadlines,
 * heap checks and dead-worker replacement. On shutdown, pending tasks are saved so the next start can resume them.
 */
@Service
public class QueueWorkerService {
    private static final Logger log = LoggerFactory.getLogger(QueueWorkerService.class);
    private static final long HEALTH_CHECK_INTERVAL_MS = 10_000;

    private final FetchTaskQueue queue;
    private final WorkerSupervisor supervisor;
    private final FetchTaskProcessor processor;
    private final JobCoordinator coordinator;
    private final JobRegistry registry;
    private final MemoryGovernor memoryGovernor;
    private final CrawlStore store;
    private final AsyncStoreWriter writer;
    private final ScheduledExecutorService scheduler;
    private final CrawlerProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final List<ScheduledFuture<?>> housekeeping = new ArrayList<>();

    public QueueWorkerService(
        FetchTaskQueue queue,
        WorkerSupervisor supervisor,
        FetchTaskProcessor processor,
        JobCoordinator coordinator,
        JobRegistry registry,
        MemoryGovernor memoryGovernor,
        CrawlStore store,
        AsyncStoreWriter writer,
        @Qualifier("crawlScheduler") ScheduledExecutorService scheduler,
        CrawlerProperties properties
    ) {
        this.queue = queue;
        this.supervisor = supervisor;
        this.processor = processor;
        this.coordinator = coordinator;
        this.registry = registry;
        this.memoryGovernor = memoryGovernor;
        this.store = store;
        this.writer = writer;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getQueue().isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public QueueStatusResponse getStatus() {
        return new QueueStatusResponse(
            running.get(),
            supervisor.activeWorkers(),
            queue.pendingCount(),
            queue.inFlightCount(),
            registry.active().size(),
            supervisor.restartCount(),
            writer.pendingWrites()
        );
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            queue.openIntake();
            if (properties.getQueue().isResumeOnStartup()) {
                resumePendingTasks();
            }
            Map<ConcurrencyClass, Integer> sizes = new EnumMap<>(ConcurrencyClass.class);
            sizes.put(ConcurrencyClass.STANDARD, properties.getQueue().getStandardWorkers());
            sizes.put(ConcurrencyClass.TRUSTED, properties.getQueue().getTrustedWorkers());
            supervisor.start(sizes, this::workerLoop);
            housekeeping.add(scheduler.scheduleWithFixedDelay(
                this::checkDeadlines,
                properties.getJob().getTimeoutCheckIntervalMs(),
                properties.getJob().getTimeoutCheckIntervalMs(),
                TimeUnit.MILLISECONDS
            ));
            housekeeping.add(scheduler.scheduleWithFixedDelay(
                memoryGovernor::runScheduledCheck,
                properties.getMemory().getCheckIntervalMs(),
                properties.getMemory().getCheckIntervalMs(),
                TimeUnit.MILLISECONDS
            ));
            housekeeping.add(scheduler.scheduleWithFixedDelay(
                this::checkWorkers,
                HEALTH_CHECK_INTERVAL_MS,
                HEALTH_CHECK_INTERVAL_MS,
                TimeUnit.MILLISECONDS
            ));
            running.set(true);
            log.info("Queue workers started standard={} trusted={}",
                sizes.get(ConcurrencyClass.STANDARD), sizes.get(ConcurrencyClass.TRUSTED));
        }
    }

    /**
     * Stops taking work, lets in-flight tasks finish within the grace period and saves what is still pending.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            queue.closeIntake();
            for (ScheduledFuture<?> future : housekeeping) {
                future.cancel(false);
            }
            housekeeping.clear();
            boolean clean = supervisor.stop(TimeUnit.SECONDS.toMillis(properties.getQueue().getShutdownGraceSeconds()));
            List<FetchTask> pending = queue.drainPending();
            savePending(pending);
            log.info("Queue workers stopped clean={} savedTasks={}", clean, pending.size());
        }
    }

    /**
     * Registers a job and queues its root page.
     */
    public void submitJob(CrawlJob job) {
        submitJob(job, false);
    }

    /**
     * Registers the job and queues its root page. With {@code seedFromSitemap}, the site's /sitemap.xml is queued
     * as well; the pages it lists share the job's page budget.
     */
    public void submitJob(CrawlJob job, boolean seedFromSitemap) {
        registry.register(job);
        coordinator.persistSnapshot(job);
        if (!coordinator.schedule(job, job.getRootUrl(), FetchTaskKind.ROOT, 0)) {
            coordinator.failSystemic(job, "queue_closed", null);
            throw new ResourceExhaustionException("queue_closed", "crawl queue is not accepting jobs");
        }
        if (seedFromSitemap) {
            coordinator.scheduleSitemap(job);
        }
        log.info("Job queued jobId={} domain={} class={} priority={}",
            job.getId(), job.getDomain(), job.getConcurrencyClass(), job.getPriority());
    }

    void workerLoop(WorkerSupervisor.WorkerHandle handle) {
        long pollIntervalMs = properties.getQueue().getPollIntervalMs();
        while (handle.shouldRun() && !Thread.currentThread().isInterrupted()) {
            handle.heartbeat();
            FetchTask task;
            try {
                task = queue.take(handle.getConcurrencyClass(), pollIntervalMs);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null) {
                continue;
            }
            try {
                processor.process(task);
            } catch (RuntimeException e) {
                log.warn("Worker {} failed on task {}", handle.getId(), task, e);
            }
        }
    }

    void checkDeadlines() {
        Instant now = Instant.now();
        for (CrawlJob job : registry.active()) {
            try {
                coordinator.expireIfOverdue(job, now);
            } catch (RuntimeException e) {
                log.warn("Deadline check failed jobId={}", job.getId(), e);
            }
        }
    }

    private void checkWorkers() {
        try {
            supervisor.healthCheck();
        } catch (RuntimeException e) {
            log.warn("Worker health check failed", e);
        }
    }

    private void savePending(List<FetchTask> pending) {
        if (pending.isEmpty()) {
            return;
        }
        List<PendingTaskRecord> records = new ArrayList<>(pending.size());
        Map<String, CrawlJob> jobs = new LinkedHashMap<>();
        for (FetchTask task : pending) {
            records.add(task.toPendingRecord());
            registry.find(task.getJobId()).ifPresent(job -> jobs.put(job.getId(), job));
        }
        try {
            store.savePendingTasks(records);
            for (CrawlJob job : jobs.values()) {
                store.saveJob(job.toSnapshot());
            }
        } catch (RuntimeException e) {
            log.warn("Could not save {} pending tasks on shutdown", records.size(), e);
        }
    }

    void resumePendingTasks() {
        List<PendingTaskRecord> records;
        try {
            records = store.loadPendingTasks();
        } catch (RuntimeException e) {
            log.warn("Could not load pending tasks; starting with an empty queue", e);
            return;
        }
        Map<String, List<PendingTaskRecord>> byJob = new LinkedHashMap<>();
        for (PendingTaskRecord record : records) {
            byJob.computeIfAbsent(record.jobId(), ignored -> new ArrayList<>()).add(record);
        }
        int resumed = 0;
        for (Map.Entry<String, List<PendingTaskRecord>> entry : byJob.entrySet()) {
            Optional<CrawlJob> job = restoreJob(entry.getKey());
            if (job.isPresent()) {
                for (PendingTaskRecord record : entry.getValue()) {
                    boolean scheduled = record.kind() == FetchTaskKind.SITEMAP
                        ? coordinator.scheduleSitemap(job.get())
                        : coordinator.schedule(job.get(), record.url(), record.kind(), record.attempts());
                    if (scheduled) {
                        resumed++;
                    }
                }
                coordinator.finishIfDone(job.get());
            }
            store.clearPendingTasks(entry.getKey());
        }
        if (!records.isEmpty()) {
            log.info("Resumed pendingTasks={} of saved={} jobs={}", resumed, records.size(), byJob.size());
        }
    }

    /**
     * Rebuilds a job from its last snapshot. The deadline restarts from now.
     */
    private Optional<CrawlJob> restoreJob(String jobId) {
        Optional<CrawlJob> known = registry.find(jobId);
        if (known.isPresent()) {
            return known.filter(job -> !job.isTerminal());
        }
        Optional<JobSnapshot> snapshot = store.findJob(jobId);
        if (snapshot.isEmpty() || snapshot.get().status().isTerminal()) {
            return Optional.empty();
        }
        JobSnapshot saved = snapshot.get();
        Instant now = Instant.now();
        CrawlJob job = new CrawlJob(
            saved.jobId(),
            saved.rootUrl(),
            saved.domain(),
            saved.concurrencyClass(),
            saved.maxPages(),
            saved.followPagination(),
            saved.followProductLinks(),
            saved.priority(),
            saved.timeoutSeconds(),
            properties.getPagination().getStallPageLimit(),
            saved.createdAt(),
            now.plusSeconds(saved.timeoutSeconds())
        );
        job.restoreProgress(saved.pagesVisited());
        registry.register(job);
        return Optional.of(job);
    }
}
