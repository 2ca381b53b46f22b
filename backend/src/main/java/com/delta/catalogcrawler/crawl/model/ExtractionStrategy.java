package com.delta.catalogcrawler.crawl.model;

import java.util.Locale;

/**
 * Extraction strategies in trust order. Lower ordinal means higher trust.
 */
public enum ExtractionStrategy {
    JSON_LD,
    MICRODATA,
    DOM_HEURISTICS,
    BASE_CONTENT;

    public boolean isStructured() {
        return this != BASE_CONTENT;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExtractionStrategy fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        try {
            return ExtractionStrategy.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
