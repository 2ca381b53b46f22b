package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ContentExtraction;
import com.delta.catalogcrawler.crawl.model.PageClassification;
import org.jsoup.nodes.Document;

/**
 * Everything a page extractor needs, parsed and classified once per page.
 */
public record PageContext(
    Document document,
    String url,
    String domain,
    PageClassification classification,
    ContentExtraction content
) {
}
