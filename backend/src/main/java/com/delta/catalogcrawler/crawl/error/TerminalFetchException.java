package com.delta.catalogcrawler.crawl.error;

import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;

public class TerminalFetchException extends CrawlException {
    private final int statusCode;

    public TerminalFetchException(String reasonCode, int statusCode, String message) {
        super(CrawlErrorKind.TERMINAL_FETCH, reasonCode, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
