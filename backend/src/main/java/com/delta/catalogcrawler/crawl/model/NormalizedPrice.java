package com.delta.catalogcrawler.crawl.model;

import java.math.BigDecimal;

public record NormalizedPrice(
    BigDecimal amount,
    String currency,
    boolean quoteOnly,
    Boolean vatIncluded
) {
    public static NormalizedPrice unknown() {
        return new NormalizedPrice(null, null, false, null);
    }

    public boolean isAmbiguous() {
        return amount == null && !quoteOnly;
    }
}
