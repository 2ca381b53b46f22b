package com.delta.catalogcrawler.crawl.model;

import java.util.Map;

public record RawVariant(
    String sku,
    String rawPrice,
    String rawAvailability,
    Map<String, String> attributes
) {
}
