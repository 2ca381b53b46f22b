package com.delta.catalogcrawler.crawl.model;

public enum ConcurrencyClass {
    STANDARD,
    TRUSTED
}
