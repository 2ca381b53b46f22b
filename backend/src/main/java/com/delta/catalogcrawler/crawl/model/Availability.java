package com.delta.catalogcrawler.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Availability {
    IN_STOCK("in_stock"),
    OUT_OF_STOCK("out_of_stock"),
    PREORDER("preorder"),
    UNKNOWN("unknown");

    private final String wireValue;

    Availability(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
