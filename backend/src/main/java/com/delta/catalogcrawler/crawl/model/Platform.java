package com.delta.catalogcrawler.crawl.model;

public enum Platform {
    WOOCOMMERCE,
    SHOPIFY,
    MAGENTO,
    BIGCOMMERCE,
    PRESTASHOP,
    SQUARESPACE,
    GENERIC_ECOMMERCE,
    UNKNOWN;

    public boolean isKnownPlatform() {
        return this != GENERIC_ECOMMERCE && this != UNKNOWN;
    }

    public boolean isEcommerce() {
        return this != UNKNOWN;
    }
}
