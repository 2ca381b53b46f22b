package com.delta.catalogcrawler.crawl.model;

import java.time.Duration;
import java.time.Instant;

public record RenderResult(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String html,
    String contentType,
    String errorCode,
    String errorMessage,
    Instant fetchedAt,
    Duration duration
) {
    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUrl == null || finalUrl.isBlank() ? requestedUrl : finalUrl;
    }
}
