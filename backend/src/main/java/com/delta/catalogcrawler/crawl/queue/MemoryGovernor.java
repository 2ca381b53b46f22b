package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic heap check. Above the high-water mark it hints a collection and pushes back the lowest-priority
 * pending tasks of any job; in-flight tasks are left alone. Pressure that persists over several checks
 * restarts the worker pool.
 */
@Component
public class MemoryGovernor {
    private static final Logger log = LoggerFactory.getLogger(MemoryGovernor.class);

    private final MemoryProbe probe;
    private final FetchTaskQueue queue;
    private final WorkerSupervisor supervisor;
    private final CrawlerProperties properties;
    private final AtomicInteger consecutiveHighChecks = new AtomicInteger();

    public MemoryGovernor(MemoryProbe probe, FetchTaskQueue queue, WorkerSupervisor supervisor, CrawlerProperties properties) {
        this.probe = probe;
        this.queue = queue;
        this.supervisor = supervisor;
        this.properties = properties;
    }

    /**
     * @return true when the heap was above the high-water mark
     */
    public boolean check() {
        CrawlerProperties.Memory config = properties.getMemory();
        double ratio = probe.heapUsageRatio();
        if (ratio < config.getHighWaterRatio()) {
            consecutiveHighChecks.set(0);
            return false;
        }
        int consecutive = consecutiveHighChecks.incrementAndGet();
        System.gc();
        int deferred = queue.deferLowestPriority(config.getRequeueBatchSize(), config.getRequeueDelayMs());
        log.warn("Memory high-water crossed ratio={} threshold={} consecutive={} deferredTasks={}",
            String.format("%.2f", ratio), config.getHighWaterRatio(), consecutive, deferred);
        if (consecutive >= config.getRestartAfterConsecutiveChecks()) {
            supervisor.restartWorkers("memory_pressure");
            consecutiveHighChecks.set(0);
        }
        return true;
    }

    public void runScheduledCheck() {
        try {
            check();
        } catch (RuntimeException e) {
            log.warn("Memory check failed", e);
        }
    }

    public int consecutiveHighChecks() {
        return consecutiveHighChecks.get();
    }
}
