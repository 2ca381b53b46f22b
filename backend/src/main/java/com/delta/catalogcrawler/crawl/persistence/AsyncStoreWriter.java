package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.PersistenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs store writes off the worker threads and counts how many are outstanding, so that
 * intake can be throttled when the store falls behind.
 */
@Component
public class AsyncStoreWriter {
    private static final Logger log = LoggerFactory.getLogger(AsyncStoreWriter.class);

    private final ExecutorService executor;
    private final CrawlerProperties properties;
    private final AtomicInteger pending = new AtomicInteger();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();

    public AsyncStoreWriter(@Qualifier("persistenceExecutor") ExecutorService executor, CrawlerProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    public CompletableFuture<Void> write(String label, Runnable write) {
        pending.incrementAndGet();
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> {
                try {
                    write.run();
                } catch (PersistenceUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new PersistenceUnavailableException("store write failed: " + label, e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            release();
            return CompletableFuture.failedFuture(new PersistenceUnavailableException("store writer stopped: " + label, e));
        }
        return future.whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Store write failed label={}", label, error);
            }
            release();
        });
    }

    public int pendingWrites() {
        return pending.get();
    }

    public boolean isSaturated() {
        return pending.get() >= properties.getPersistence().getBackpressureThreshold();
    }

    /**
     * Waits until outstanding writes drop below the backpressure threshold.
     *
     * @return false when the wait timed out or was interrupted with the writer still saturated
     */
    public boolean awaitCapacity(long waitMs) {
        return awaitBelow(properties.getPersistence().getBackpressureThreshold(), waitMs);
    }

    public boolean flush(long waitMs) {
        return awaitBelow(1, waitMs);
    }

    private boolean awaitBelow(int limit, long waitMs) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, waitMs));
        lock.lock();
        try {
            while (pending.get() >= limit) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return pending.get() < limit;
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        pending.decrementAndGet();
        lock.lock();
        try {
            drained.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
