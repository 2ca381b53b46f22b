package com.delta.catalogcrawler.crawl.model;

import java.time.Duration;

public record RenderOptions(boolean blockResources, Duration timeout, ConcurrencyClass concurrencyClass) {
}
