package com.delta.catalogcrawler.crawl.model;

public record StrategySuggestion(
    ExtractionStrategy strategy,
    double confidence,
    boolean skipLowerPriority
) {
}
