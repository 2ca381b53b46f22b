package com.delta.catalogcrawler.crawl.model;

import java.util.Locale;

public enum PageType {
    PRODUCT,
    LISTING,
    ARTICLE,
    GENERIC;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PageType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return GENERIC;
        }
        try {
            return PageType.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }
}
