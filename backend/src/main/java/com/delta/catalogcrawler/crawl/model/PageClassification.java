package com.delta.catalogcrawler.crawl.model;

public record PageClassification(PageType pageType, Platform platform) {
}
