package com.delta.catalogcrawler.crawl.extract.strategy;

import com.delta.catalogcrawler.crawl.extract.PageContext;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.RawProduct;

import java.util.List;
import java.util.Optional;

public interface ProductExtractionStrategy {

    ExtractionStrategy strategy();

    /**
     * The main product of a product detail page, if this strategy can find one.
     */
    Optional<RawProduct> extractProduct(PageContext context);

    /**
     * Products summarized on a listing page, in page order.
     */
    List<RawProduct> extractListing(PageContext context);
}
