package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PaginationHint;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

@Component
public class ContentPageExtractor implements PageExtractor {

    @Override
    public Set<PageType> handles() {
        return EnumSet.of(PageType.ARTICLE, PageType.GENERIC);
    }

    @Override
    public ExtractionResult extract(PageContext context, PaginationHint pagination) {
        return ExtractionResult.fromContent(
            context.url(),
            context.classification().pageType(),
            context.classification().platform(),
            context.content(),
            pagination
        );
    }
}
