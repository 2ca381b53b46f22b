package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void retriesTransientFailuresUpToMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(new CrawlerProperties());

        assertThat(policy.shouldRetry(FailureReasonClassifier.HTTP_5XX, 1)).isTrue();
        assertThat(policy.shouldRetry(FailureReasonClassifier.TIMEOUT, 2)).isTrue();
        assertThat(policy.shouldRetry(FailureReasonClassifier.HTTP_5XX, 3)).isFalse();
    }

    @Test
    void neverRetriesTerminalFailures() {
        RetryPolicy policy = new RetryPolicy(new CrawlerProperties());

        assertThat(policy.shouldRetry(FailureReasonClassifier.HTTP_404, 1)).isFalse();
        assertThat(policy.shouldRetry(FailureReasonClassifier.ROBOTS_BLOCKED, 1)).isFalse();
        assertThat(policy.shouldRetry(null, 1)).isFalse();
    }

    @Test
    void backoffGrowsExponentiallyWithinCap() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getQueue().setRetryBaseDelayMs(100);
        properties.getQueue().setRetryMaxDelayMs(1000);
        RetryPolicy policy = new RetryPolicy(properties);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.backoffDelayMs(1)).isBetween(50L, 99L);
            assertThat(policy.backoffDelayMs(3)).isBetween(200L, 399L);
            assertThat(policy.backoffDelayMs(12)).isBetween(500L, 999L);
        }
    }

    @Test
    void zeroBaseDelayMeansNoWait() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getQueue().setRetryBaseDelayMs(0);

        assertThat(new RetryPolicy(properties).backoffDelayMs(5)).isZero();
    }
}
