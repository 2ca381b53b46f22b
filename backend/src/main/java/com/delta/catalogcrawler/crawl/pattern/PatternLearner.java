package com.delta.catalogcrawler.crawl.pattern;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PatternKey;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.StrategySuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Remembers which extraction strategy worked per (domain, page type).
 * <p>
 * Success moves confidence toward 1 by a fixed fraction of the remaining gap; failure multiplies it by the decay
 * factor. Both keep it inside [0, 1]. After the configured number of consecutive failures the record is invalidated
 * and the next visit runs the full strategy chain.
 */
@Service
public class PatternLearner {
    private static final Logger log = LoggerFactory.getLogger(PatternLearner.class);

    private final PatternCache cache;
    private final CrawlerProperties properties;

    public PatternLearner(PatternCache cache, CrawlerProperties properties) {
        this.cache = cache;
        this.properties = properties;
    }

    public PatternRecord recordOutcome(String domain, PageType pageType, ExtractionStrategy strategy, boolean success) {
        if (domain == null || domain.isBlank() || strategy == null) {
            return null;
        }
        PatternKey key = new PatternKey(domain, pageType);
        PatternRecord stored = cache.update(key, current -> success
            ? onSuccess(key, current, strategy)
            : onFailure(current, strategy));
        if (stored != null && stored.invalidated()) {
            log.info("Pattern invalidated domain={} pageType={} strategy={} failures={}",
                key.domain(), key.pageType().key(), stored.strategy().key(), stored.consecutiveFailures());
        }
        return stored;
    }

    public Optional<StrategySuggestion> suggestStrategy(String domain, PageType pageType) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        double threshold = properties.getPattern().getHighConfidenceThreshold();
        return cache.get(new PatternKey(domain, pageType))
            .filter(record -> !record.invalidated())
            .map(record -> new StrategySuggestion(record.strategy(), record.confidence(), record.confidence() > threshold));
    }

    private PatternRecord onSuccess(PatternKey key, PatternRecord current, ExtractionStrategy strategy) {
        CrawlerProperties.Pattern config = properties.getPattern();
        Instant now = Instant.now();
        if (current == null || current.strategy() != strategy) {
            long successes = current == null ? 1 : current.successCount() + 1;
            long failures = current == null ? 0 : current.failureCount();
            return new PatternRecord(
                key.domain(), key.pageType(), strategy, clamp(config.getInitialConfidence()),
                0, successes, failures, 0, now, false
            );
        }
        double confidence = current.confidence() + (1.0 - current.confidence()) * config.getLearningRate();
        return new PatternRecord(
            current.domain(), current.pageType(), strategy, clamp(confidence),
            0, current.successCount() + 1, current.failureCount(), current.version(), now, false
        );
    }

    private PatternRecord onFailure(PatternRecord current, ExtractionStrategy strategy) {
        if (current == null || current.strategy() != strategy) {
            // nothing learned for this strategy, so nothing to decay
            return current;
        }
        CrawlerProperties.Pattern config = properties.getPattern();
        int consecutive = current.consecutiveFailures() + 1;
        return new PatternRecord(
            current.domain(),
            current.pageType(),
            strategy,
            clamp(current.confidence() * config.getFailureDecay()),
            consecutive,
            current.successCount(),
            current.failureCount() + 1,
            current.version(),
            current.lastValidatedAt(),
            consecutive >= config.getInvalidateAfterFailures()
        );
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
