package com.delta.catalogcrawler.crawl.pattern;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PatternKey;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.StrategySuggestion;
import com.delta.catalogcrawler.crawl.persistence.AsyncStoreWriter;
import com.delta.catalogcrawler.crawl.persistence.InMemoryCrawlStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternLearnerTest {
    private static final String DOMAIN = "shop.example.com";

    private ExecutorService writeExecutor;
    private ExecutorService loadExecutor;
    private InMemoryCrawlStore store;
    private AsyncStoreWriter writer;
    private PatternCache cache;
    private PatternLearner learner;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        writeExecutor = Executors.newSingleThreadExecutor();
        loadExecutor = Executors.newSingleThreadExecutor();
        store = new InMemoryCrawlStore();
        writer = new AsyncStoreWriter(writeExecutor, properties);
        cache = new PatternCache(store, writer, loadExecutor);
        learner = new PatternLearner(cache, properties);
    }

    @AfterEach
    void tearDown() {
        writeExecutor.shutdownNow();
        loadExecutor.shutdownNow();
    }

    @Test
    void firstSuccessStartsAtInitialConfidence() {
        PatternRecord record = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.MICRODATA, true);

        assertThat(record.confidence()).isCloseTo(0.5, within(1e-9));
        assertThat(record.version()).isEqualTo(1);
        assertThat(record.invalidated()).isFalse();
    }

    @Test
    void successMovesConfidenceTowardOneWithoutReachingIt() {
        PatternRecord record = null;
        for (int i = 0; i < 200; i++) {
            record = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, true);
            assertThat(record.confidence()).isBetween(0.0, 1.0);
        }
        assertThat(record.confidence()).isGreaterThan(0.99);
        assertThat(record.successCount()).isEqualTo(200);
    }

    @Test
    void suggestionSkipsLowerStrategiesOnlyAboveThreshold() {
        for (int i = 0; i < 4; i++) {
            learner.recordOutcome(DOMAIN, PageType.LISTING, ExtractionStrategy.DOM_HEURISTICS, true);
        }
        StrategySuggestion moderate = learner.suggestStrategy(DOMAIN, PageType.LISTING).orElseThrow();
        assertThat(moderate.confidence()).isCloseTo(0.7890625, within(1e-9));
        assertThat(moderate.skipLowerPriority()).isFalse();

        learner.recordOutcome(DOMAIN, PageType.LISTING, ExtractionStrategy.DOM_HEURISTICS, true);
        StrategySuggestion confident = learner.suggestStrategy(DOMAIN, PageType.LISTING).orElseThrow();
        assertThat(confident.strategy()).isEqualTo(ExtractionStrategy.DOM_HEURISTICS);
        assertThat(confident.skipLowerPriority()).isTrue();
    }

    @Test
    void failuresDecayAndInvalidateAfterThreeInARow() {
        for (int i = 0; i < 5; i++) {
            learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, true);
        }
        PatternRecord first = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);
        assertThat(first.confidence()).isCloseTo(0.841796875 / 2, within(1e-9));
        assertThat(first.consecutiveFailures()).isEqualTo(1);

        learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);
        PatternRecord third = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);

        assertThat(third.invalidated()).isTrue();
        assertThat(third.confidence()).isBetween(0.0, 1.0);
        assertThat(learner.suggestStrategy(DOMAIN, PageType.PRODUCT)).isEmpty();

        assertThat(writer.flush(2000)).isTrue();
        PatternRecord persisted = store.patterns.get(new PatternKey(DOMAIN, PageType.PRODUCT));
        assertThat(persisted.invalidated()).isTrue();
        assertThat(persisted.failureCount()).isEqualTo(3);
    }

    @Test
    void successInBetweenResetsTheFailureStreak() {
        learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, true);
        learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);
        learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);
        PatternRecord recovered = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, true);
        PatternRecord afterFailure = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);

        assertThat(recovered.consecutiveFailures()).isZero();
        assertThat(afterFailure.consecutiveFailures()).isEqualTo(1);
        assertThat(afterFailure.invalidated()).isFalse();
    }

    @Test
    void winningWithAnotherStrategyReplacesThePattern() {
        for (int i = 0; i < 3; i++) {
            learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.DOM_HEURISTICS, true);
        }
        PatternRecord replaced = learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.MICRODATA, true);

        assertThat(replaced.strategy()).isEqualTo(ExtractionStrategy.MICRODATA);
        assertThat(replaced.confidence()).isCloseTo(0.5, within(1e-9));
        assertThat(replaced.successCount()).isEqualTo(4);
    }

    @Test
    void failureOfAnUnlearnedStrategyChangesNothing() {
        learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, true);

        learner.recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.MICRODATA, false);

        Optional<StrategySuggestion> suggestion = learner.suggestStrategy(DOMAIN, PageType.PRODUCT);
        assertThat(suggestion).map(StrategySuggestion::strategy).contains(ExtractionStrategy.JSON_LD);
        assertThat(learner.recordOutcome(DOMAIN, PageType.ARTICLE, ExtractionStrategy.JSON_LD, false)).isNull();
    }

    @Test
    void domainsAreMatchedCaseInsensitively() {
        learner.recordOutcome("Shop.Example.COM", PageType.PRODUCT, ExtractionStrategy.JSON_LD, true);

        assertThat(learner.suggestStrategy("shop.example.com", PageType.PRODUCT)).isPresent();
    }
}
