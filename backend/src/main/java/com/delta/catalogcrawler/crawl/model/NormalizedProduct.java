package com.delta.catalogcrawler.crawl.model;

import java.util.List;
import java.util.Map;

public record NormalizedProduct(
    String name,
    NormalizedPrice price,
    Availability availability,
    String sku,
    List<NormalizedVariant> variants,
    Map<String, String> specs,
    String url,
    List<String> images,
    String brand
) {
}
