package com.delta.catalogcrawler.crawl.model;

import java.util.Map;

public record NormalizedVariant(
    String sku,
    NormalizedPrice price,
    Availability availability,
    Map<String, String> attributes
) {
}
