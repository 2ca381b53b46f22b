package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.RawProduct;

import java.util.List;

/**
 * What one extraction strategy produced for a page, scored for completeness.
 */
public record StrategyRun(
    ExtractionStrategy strategy,
    List<RawProduct> products,
    double completeness,
    double confidence,
    boolean sufficient
) {
    public StrategyRun {
        products = products == null ? List.of() : List.copyOf(products);
    }

    public boolean hasNamedProduct() {
        return products.stream().anyMatch(product -> product.name() != null && !product.name().isBlank());
    }

    boolean betterThan(StrategyRun other) {
        if (other == null) {
            return true;
        }
        if (sufficient != other.sufficient) {
            return sufficient;
        }
        return confidence > other.confidence;
    }
}
