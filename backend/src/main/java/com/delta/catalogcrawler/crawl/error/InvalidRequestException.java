package com.delta.catalogcrawler.crawl.error;

import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;

public class InvalidRequestException extends CrawlException {
    public InvalidRequestException(String reasonCode, String message) {
        super(CrawlErrorKind.INVALID_REQUEST, reasonCode, message);
    }
}
