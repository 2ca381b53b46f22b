package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PaginationHint;

import java.util.Set;

/**
 * Extraction for the page types it {@link #handles()}. Implementations never return null.
 */
public interface PageExtractor {

    Set<PageType> handles();

    ExtractionResult extract(PageContext context, PaginationHint pagination);
}
