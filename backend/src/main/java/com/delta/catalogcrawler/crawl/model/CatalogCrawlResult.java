package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record CatalogCrawlResult(
    List<NormalizedProduct> products,
    int pagesVisited,
    CatalogStopReason stopReason,
    List<FailureLedgerEntry> errors
) {
}
