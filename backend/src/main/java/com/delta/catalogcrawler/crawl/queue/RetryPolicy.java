package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Transient failures are retried up to {@code maxAttempts} total attempts with exponential backoff and jitter;
 * everything else fails on the first attempt.
 */
@Component
public class RetryPolicy {
    private final CrawlerProperties properties;

    public RetryPolicy(CrawlerProperties properties) {
        this.properties = properties;
    }

    public int maxAttempts() {
        return properties.getQueue().getMaxAttempts();
    }

    public boolean isRetryable(String reasonCode) {
        return FailureReasonClassifier.isRetryable(reasonCode);
    }

    public boolean shouldRetry(String reasonCode, int attemptsSoFar) {
        return isRetryable(reasonCode) && attemptsSoFar < maxAttempts();
    }

    /**
     * Delay before attempt {@code attempt + 1}: base * 2^(attempt-1) capped at the configured maximum,
     * then drawn uniformly from the upper half of that value.
     */
    public long backoffDelayMs(int attempt) {
        long baseDelayMs = properties.getQueue().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        long maxDelayMs = properties.getQueue().getRetryMaxDelayMs();
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = baseDelayMs * (1L << shift);
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 1) {
            return delay;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }

    /**
     * @return false when interrupted while waiting
     */
    public boolean sleepBackoff(int attempt) {
        long sleepMs = backoffDelayMs(attempt);
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
