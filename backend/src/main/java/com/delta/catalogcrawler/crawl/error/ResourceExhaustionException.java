package com.delta.catalogcrawler.crawl.error;

import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;

public class ResourceExhaustionException extends CrawlException {
    public ResourceExhaustionException(String reasonCode, String message) {
        super(CrawlErrorKind.RESOURCE_EXHAUSTION, reasonCode, message);
    }
}
