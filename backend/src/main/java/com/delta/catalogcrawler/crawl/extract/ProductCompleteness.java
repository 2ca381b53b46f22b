package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.RawProduct;

final class ProductCompleteness {
    private ProductCompleteness() {
    }

    static double score(RawProduct product) {
        if (product == null) {
            return 0.0;
        }
        double score = 0.0;
        if (present(product.name())) {
            score += 0.35;
        }
        if (present(product.rawPrice())) {
            score += 0.30;
        }
        if (present(product.sku())) {
            score += 0.15;
        }
        if (present(product.rawAvailability())) {
            score += 0.10;
        }
        if (!product.images().isEmpty()) {
            score += 0.10;
        }
        return Math.min(1.0, score);
    }

    static boolean isSufficient(RawProduct product, double threshold) {
        return product != null && present(product.name()) && score(product) >= threshold;
    }

    static double trust(ExtractionStrategy strategy) {
        return switch (strategy) {
            case JSON_LD -> 1.0;
            case MICRODATA -> 0.9;
            case DOM_HEURISTICS -> 0.75;
            case BASE_CONTENT -> 0.4;
        };
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
