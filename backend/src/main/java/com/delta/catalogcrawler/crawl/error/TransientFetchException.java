package com.delta.catalogcrawler.crawl.error;

import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;

public class TransientFetchException extends CrawlException {
    private final int statusCode;

    public TransientFetchException(String reasonCode, int statusCode, String message) {
        super(CrawlErrorKind.TRANSIENT_FETCH, reasonCode, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
