package com.delta.catalogcrawler.crawl.model;

/**
 * Undecoded response of a non-page document. {@code body} is null whenever {@code errorCode} is set.
 */
public record FetchedBytes(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String contentType,
    String contentEncoding,
    byte[] body,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return errorCode == null && body != null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUrl == null || finalUrl.isBlank() ? requestedUrl : finalUrl;
    }
}
