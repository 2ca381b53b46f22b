package com.delta.catalogcrawler.crawl.model;

public record SpecEntry(String key, String value) {
}
