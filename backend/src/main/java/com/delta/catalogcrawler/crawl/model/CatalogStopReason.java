package com.delta.catalogcrawler.crawl.model;

public enum CatalogStopReason {
    NO_FURTHER_PAGINATION("no further pagination"),
    MAX_PAGES_REACHED("max pages reached"),
    STALLED("stalled: no new products"),
    FETCH_FAILED("start page fetch failed"),
    CANCELLED("cancelled");

    private final String description;

    CatalogStopReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
