package com.delta.catalogcrawler.crawl.model;

import java.util.List;

/**
 * Product fields as found on the page, before normalization.
 */
public record RawProduct(
    String name,
    String rawPrice,
    String rawAvailability,
    String sku,
    String url,
    String brand,
    String description,
    List<String> images,
    List<RawVariant> variants,
    List<SpecEntry> specs
) {
    public RawProduct {
        images = images == null ? List.of() : List.copyOf(images);
        variants = variants == null ? List.of() : List.copyOf(variants);
        specs = specs == null ? List.of() : List.copyOf(specs);
    }

    public RawProduct withDetails(List<RawVariant> newVariants, List<SpecEntry> newSpecs, List<String> newImages) {
        return new RawProduct(
            name,
            rawPrice,
            rawAvailability,
            sku,
            url,
            brand,
            description,
            newImages == null || newImages.isEmpty() ? images : newImages,
            newVariants == null || newVariants.isEmpty() ? variants : newVariants,
            newSpecs == null || newSpecs.isEmpty() ? specs : newSpecs
        );
    }
}
