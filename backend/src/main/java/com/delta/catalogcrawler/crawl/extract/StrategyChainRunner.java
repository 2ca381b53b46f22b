package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.extract.strategy.ProductExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.StrategySuggestion;
import com.delta.catalogcrawler.crawl.pattern.PatternLearner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs the product strategies in trust order and stops at the first sufficiently complete record.
 * A confident learned pattern lets the chain start (and usually end) at the learned strategy; when that
 * strategy comes up short, the full chain runs within the same call.
 */
@Component
public class StrategyChainRunner {
    private static final Logger log = LoggerFactory.getLogger(StrategyChainRunner.class);

    private final List<ProductExtractionStrategy> strategies;
    private final PatternLearner patternLearner;
    private final CrawlerProperties properties;

    public StrategyChainRunner(
        List<ProductExtractionStrategy> strategies,
        PatternLearner patternLearner,
        CrawlerProperties properties
    ) {
        this.strategies = List.copyOf(strategies);
        this.patternLearner = patternLearner;
        this.properties = properties;
    }

    public StrategyRun runProduct(PageContext context) {
        return run(context, PageType.PRODUCT, false);
    }

    public StrategyRun runListing(PageContext context) {
        return run(context, PageType.LISTING, true);
    }

    private StrategyRun run(PageContext context, PageType pageType, boolean listing) {
        String domain = context.domain();
        Optional<StrategySuggestion> suggestion = patternLearner.suggestStrategy(domain, pageType);
        ExtractionStrategy suggested = suggestion.map(StrategySuggestion::strategy).orElse(null);
        StrategyRun best = null;
        ExtractionStrategy alreadyTried = null;

        if (suggestion.isPresent() && suggestion.get().skipLowerPriority()) {
            ProductExtractionStrategy learned = find(suggested);
            if (learned != null) {
                StrategyRun run = attempt(learned, context, listing);
                if (run.sufficient()) {
                    log.debug("Learned strategy hit domain={} pageType={} strategy={}", domain, pageType.key(), suggested.key());
                    patternLearner.recordOutcome(domain, pageType, suggested, true);
                    return run;
                }
                log.debug("Learned strategy missed domain={} pageType={} strategy={}, running full chain",
                    domain, pageType.key(), suggested.key());
                patternLearner.recordOutcome(domain, pageType, suggested, false);
                alreadyTried = suggested;
                best = run;
            }
        }

        StrategyRun winner = null;
        for (ProductExtractionStrategy strategy : strategies) {
            if (strategy.strategy() == alreadyTried) {
                continue;
            }
            StrategyRun run = attempt(strategy, context, listing);
            if (run.betterThan(best)) {
                best = run;
            }
            if (run.sufficient()) {
                winner = run;
                break;
            }
        }

        // a suggestion ahead of the winner in trust order was attempted and came up short
        boolean suggestedLost = suggested != null && alreadyTried == null
            && (winner == null || suggested.ordinal() < winner.strategy().ordinal());
        if (suggestedLost) {
            patternLearner.recordOutcome(domain, pageType, suggested, false);
        }
        if (winner != null) {
            patternLearner.recordOutcome(domain, pageType, winner.strategy(), true);
        }
        return best;
    }

    private StrategyRun attempt(ProductExtractionStrategy strategy, PageContext context, boolean listing) {
        double threshold = properties.getExtraction().getCompletenessThreshold();
        double trust = ProductCompleteness.trust(strategy.strategy());
        if (listing) {
            List<RawProduct> products = strategy.extractListing(context);
            if (products.isEmpty()) {
                return new StrategyRun(strategy.strategy(), List.of(), 0.0, 0.0, false);
            }
            double total = 0.0;
            for (RawProduct product : products) {
                total += ProductCompleteness.score(product);
            }
            double completeness = total / products.size();
            boolean named = products.stream().anyMatch(product -> product.name() != null && !product.name().isBlank());
            return new StrategyRun(strategy.strategy(), products, completeness, trust * completeness, named && completeness >= threshold);
        }
        Optional<RawProduct> product = strategy.extractProduct(context);
        if (product.isEmpty()) {
            return new StrategyRun(strategy.strategy(), List.of(), 0.0, 0.0, false);
        }
        double completeness = ProductCompleteness.score(product.get());
        return new StrategyRun(
            strategy.strategy(),
            List.of(product.get()),
            completeness,
            trust * completeness,
            ProductCompleteness.isSufficient(product.get(), threshold)
        );
    }

    private ProductExtractionStrategy find(ExtractionStrategy strategy) {
        for (ProductExtractionStrategy candidate : strategies) {
            if (candidate.strategy() == strategy) {
                return candidate;
            }
        }
        return null;
    }
}
