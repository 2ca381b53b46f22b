package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.extract.strategy.DomHeuristicsProductStrategy;
import com.delta.catalogcrawler.crawl.extract.strategy.JsonLdProductStrategy;
import com.delta.catalogcrawler.crawl.extract.strategy.MicrodataProductStrategy;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PatternKey;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.StrategySuggestion;
import com.delta.catalogcrawler.crawl.pattern.PatternLearner;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StrategyChainRunnerTest {
    private static final String DOMAIN = "shop.example.com";
    private static final String URL = "https://shop.example.com/products/field-jacket";
    private static final PatternKey PRODUCT_KEY = new PatternKey(DOMAIN, PageType.PRODUCT);

    private static final String MICRODATA_ONLY =
        """
            <html><head><title>Field Jacket</title></head><body>
            <div itemscope itemtype="https://schema.org/Product">
              <h1 itemprop="name">Field Jacket</h1>
              <span itemprop="sku">FJ-7</span>
              <div itemprop="offers" itemscope itemtype="https://schema.org/Offer">
                <meta itemprop="priceCurrency" content="EUR">
                <span itemprop="price" content="89.00">89,00 EUR</span>
                <link itemprop="availability" href="https://schema.org/InStock">
              </div>
            </div>
            </body></html>
            """;

    private static final String BOTH_FORMATS =
        """
            <html><head><title>Field Jacket</title>
            <script type="application/ld+json">
            {"@type":"Product","name":"Field Jacket (linked data)","sku":"FJ-7",
             "offers":{"@type":"Offer","price":"89.00","priceCurrency":"EUR"}}
            </script></head><body>
            <div itemscope itemtype="https://schema.org/Product">
              <h1 itemprop="name">Field Jacket</h1>
              <span itemprop="sku">FJ-7</span>
              <div itemprop="offers" itemscope itemtype="https://schema.org/Offer">
                <meta itemprop="priceCurrency" content="EUR">
                <span itemprop="price" content="89.00">89,00 EUR</span>
              </div>
            </div>
            </body></html>
            """;

    private static final String NO_PRODUCT =
        "<html><head><title>Sizing</title></head><body><p>Our jackets run small.</p></body></html>";

    private final ExtractorFixture fixture = new ExtractorFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void confidentPatternThatMissesFallsBackToTheFullChain() {
        seed(ExtractionStrategy.JSON_LD, 0.9, 4);

        StrategyRun run = fixture.chainRunner.runProduct(context(MICRODATA_ONLY));

        assertThat(run.strategy()).isEqualTo(ExtractionStrategy.MICRODATA);
        assertThat(run.sufficient()).isTrue();
        assertThat(run.products()).singleElement().satisfies(product -> {
            assertThat(product.name()).isEqualTo("Field Jacket");
            assertThat(product.sku()).isEqualTo("FJ-7");
        });
        PatternRecord learned = fixture.patternCache.get(PRODUCT_KEY).orElseThrow();
        assertThat(learned.strategy()).isEqualTo(ExtractionStrategy.MICRODATA);
        assertThat(learned.confidence()).isCloseTo(0.5, within(1e-9));
        assertThat(learned.failureCount()).isEqualTo(1);
        assertThat(learned.successCount()).isEqualTo(5);
    }

    @Test
    void missWithNoWinnerDecaysTheLearnedConfidence() {
        seed(ExtractionStrategy.JSON_LD, 0.9, 4);

        StrategyRun run = fixture.chainRunner.runProduct(context(NO_PRODUCT));

        assertThat(run.sufficient()).isFalse();
        PatternRecord learned = fixture.patternCache.get(PRODUCT_KEY).orElseThrow();
        assertThat(learned.strategy()).isEqualTo(ExtractionStrategy.JSON_LD);
        assertThat(learned.confidence()).isCloseTo(0.45, within(1e-9));
        assertThat(learned.consecutiveFailures()).isEqualTo(1);
        assertThat(learned.invalidated()).isFalse();
    }

    @Test
    void fallbackRecordsTheMissBeforeTheWinner() {
        PatternLearner learner = Mockito.mock(PatternLearner.class);
        when(learner.suggestStrategy(anyString(), any()))
            .thenReturn(Optional.of(new StrategySuggestion(ExtractionStrategy.JSON_LD, 0.9, true)));
        StrategyChainRunner runner = runnerWith(learner);

        runner.runProduct(context(MICRODATA_ONLY));

        InOrder order = inOrder(learner);
        order.verify(learner).recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.JSON_LD, false);
        order.verify(learner).recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.MICRODATA, true);
        verify(learner, never()).recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.DOM_HEURISTICS, true);
    }

    @Test
    void confidentPatternThatHitsSkipsHigherTrustStrategies() {
        seed(ExtractionStrategy.MICRODATA, 0.9, 10);

        StrategyRun run = fixture.chainRunner.runProduct(context(BOTH_FORMATS));

        assertThat(run.strategy()).isEqualTo(ExtractionStrategy.MICRODATA);
        assertThat(run.products().get(0).name()).isEqualTo("Field Jacket");
        PatternRecord learned = fixture.patternCache.get(PRODUCT_KEY).orElseThrow();
        assertThat(learned.confidence()).isCloseTo(0.925, within(1e-9));
    }

    @Test
    void unconfidentPatternRunsTheChainInTrustOrder() {
        seed(ExtractionStrategy.MICRODATA, 0.6, 2);

        StrategyRun run = fixture.chainRunner.runProduct(context(BOTH_FORMATS));

        assertThat(run.strategy()).isEqualTo(ExtractionStrategy.JSON_LD);
        PatternRecord learned = fixture.patternCache.get(PRODUCT_KEY).orElseThrow();
        assertThat(learned.strategy()).isEqualTo(ExtractionStrategy.JSON_LD);
    }

    @Test
    void withoutAPatternTheLearnerOnlyHearsAboutTheWinner() {
        PatternLearner learner = Mockito.mock(PatternLearner.class);
        when(learner.suggestStrategy(anyString(), any())).thenReturn(Optional.empty());

        runnerWith(learner).runProduct(context(MICRODATA_ONLY));

        verify(learner).recordOutcome(DOMAIN, PageType.PRODUCT, ExtractionStrategy.MICRODATA, true);
        verify(learner, never()).recordOutcome(anyString(), any(), any(), Mockito.eq(false));
        verify(learner, Mockito.times(1)).recordOutcome(anyString(), any(), any(), anyBoolean());
    }

    private void seed(ExtractionStrategy strategy, double confidence, long successes) {
        fixture.patternCache.update(PRODUCT_KEY, ignored -> new PatternRecord(
            DOMAIN, PageType.PRODUCT, strategy, confidence, 0, successes, 0, 0, Instant.now(), false
        ));
    }

    private StrategyChainRunner runnerWith(PatternLearner learner) {
        return new StrategyChainRunner(
            List.of(
                new JsonLdProductStrategy(fixture.jsonLdReader),
                new MicrodataProductStrategy(),
                new DomHeuristicsProductStrategy()
            ),
            learner,
            fixture.properties
        );
    }

    private PageContext context(String html) {
        Document document = Jsoup.parse(html, URL);
        return new PageContext(
            document,
            URL,
            DOMAIN,
            fixture.pageClassifier.classify(document, URL),
            new ContentExtractor(fixture.properties).extract(document)
        );
    }
}
