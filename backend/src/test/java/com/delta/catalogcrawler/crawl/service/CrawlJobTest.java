package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlJobTest {

    @Test
    void claimPageRespectsBudgetAndDedup() {
        CrawlJob job = job(2);

        assertTrue(job.claimPage("https://shop.example.com/a"));
        assertFalse(job.claimPage("https://shop.example.com/a"));
        assertTrue(job.claimPage("https://shop.example.com/b"));
        assertFalse(job.claimPage("https://shop.example.com/c"));

        job.releasePage("https://shop.example.com/b");
        assertTrue(job.claimPage("https://shop.example.com/c"));
    }

    @Test
    void concurrentClaimsNeverExceedBudget() throws Exception {
        CrawlJob job = job(25);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        if (job.claimPage("https://shop.example.com/p/" + thread + "-" + i)) {
                            granted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(25, granted.get());
    }

    @Test
    void finishHappensOnce() {
        CrawlJob job = job(5);
        assertTrue(job.markRunning());

        assertTrue(job.finish(JobStatus.COMPLETED, Instant.now()));
        assertFalse(job.finish(JobStatus.CANCELLED, Instant.now()));
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertTrue(job.claimCompletionEvent());
        assertFalse(job.claimCompletionEvent());
    }

    @Test
    void errorRatioCountsResolvedTasks() {
        CrawlJob job = job(5);
        assertEquals(0.0, job.errorRatio());

        job.taskScheduled();
        job.taskScheduled();
        job.taskScheduled();
        job.taskResolved(false);
        job.taskResolved(true);

        assertEquals(0.5, job.errorRatio());
        assertEquals(1, job.errorCount());
        assertEquals(1, job.outstandingTasks());
    }

    @Test
    void cancellationStopsTaskIntake() {
        CrawlJob job = job(5);
        assertTrue(job.isAcceptingTasks());

        job.requestCancel();

        assertFalse(job.isAcceptingTasks());
    }

    @Test
    void duplicateContentIsSavedOnce() {
        CrawlJob job = job(5);

        assertTrue(job.markContentSaved("abc"));
        assertFalse(job.markContentSaved("abc"));
    }

    private static CrawlJob job(int maxPages) {
        Instant now = Instant.now();
        return new CrawlJob(
            "job-1", "https://shop.example.com/", "shop.example.com", ConcurrencyClass.STANDARD,
            maxPages, true, true, 5, 60, 3, now, now.plusSeconds(60)
        );
    }
}
