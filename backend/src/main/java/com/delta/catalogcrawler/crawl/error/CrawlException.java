package com.delta.catalogcrawler.crawl.error;

import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;

public abstract class CrawlException extends RuntimeException {
    private final CrawlErrorKind kind;
    private final String reasonCode;

    protected CrawlException(CrawlErrorKind kind, String reasonCode, String message) {
        super(message);
        this.kind = kind;
        this.reasonCode = reasonCode;
    }

    protected CrawlException(CrawlErrorKind kind, String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.reasonCode = reasonCode;
    }

    public CrawlErrorKind getKind() {
        return kind;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
