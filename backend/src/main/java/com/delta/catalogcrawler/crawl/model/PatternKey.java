package com.delta.catalogcrawler.crawl.model;

import java.util.Locale;

public record PatternKey(String domain, PageType pageType) {
    public PatternKey {
        domain = domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
        pageType = pageType == null ? PageType.GENERIC : pageType;
    }
}
