package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PaginationHint;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.RawVariant;
import com.delta.catalogcrawler.crawl.model.SpecEntry;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class ProductPageExtractor implements PageExtractor {
    private static final Logger log = LoggerFactory.getLogger(ProductPageExtractor.class);

    private final StrategyChainRunner chainRunner;
    private final ProductDetailsExtractor detailsExtractor;

    public ProductPageExtractor(StrategyChainRunner chainRunner, ProductDetailsExtractor detailsExtractor) {
        this.chainRunner = chainRunner;
        this.detailsExtractor = detailsExtractor;
    }

    @Override
    public Set<PageType> handles() {
        return EnumSet.of(PageType.PRODUCT);
    }

    @Override
    public ExtractionResult extract(PageContext context, PaginationHint pagination) {
        StrategyRun run = chainRunner.runProduct(context);
        if (run == null || !run.hasNamedProduct()) {
            return withoutProductData(context, pagination);
        }
        RawProduct product = enrich(run.products().get(0), context);
        boolean lowConfidence = !run.sufficient();
        if (lowConfidence) {
            log.debug("Low confidence product extraction url={} strategy={} completeness={}",
                context.url(), run.strategy().key(), run.completeness());
        }
        return new ExtractionResult(
            context.url(),
            PageType.PRODUCT,
            context.classification().platform(),
            DomSupport.firstNonBlank(product.name(), context.content().title()),
            context.content().cleanedText(),
            product.images().isEmpty() ? context.content().images() : product.images(),
            context.content().publishedDate(),
            context.content().contentHash(),
            run.strategy(),
            run.confidence(),
            lowConfidence,
            List.of(product),
            pagination,
            DomSupport.breadcrumbs(context.document()),
            null,
            List.of()
        );
    }

    private RawProduct enrich(RawProduct product, PageContext context) {
        Document document = context.document();
        List<RawVariant> variants = product.variants().isEmpty()
            ? detailsExtractor.extractVariants(document, context.classification().platform())
            : product.variants();
        List<SpecEntry> specs = new ArrayList<>(product.specs());
        specs.addAll(detailsExtractor.extractSpecs(document));
        List<String> images = product.images().isEmpty() ? detailsExtractor.extractGalleryImages(document) : product.images();
        return product.withDetails(variants, specs, images);
    }

    /**
     * A known storefront keeps its product classification with base content; anything else is generic.
     */
    private ExtractionResult withoutProductData(PageContext context, PaginationHint pagination) {
        boolean knownPlatform = context.classification().platform().isKnownPlatform();
        PageType pageType = knownPlatform ? PageType.PRODUCT : PageType.GENERIC;
        ExtractionResult base = ExtractionResult.fromContent(
            context.url(), pageType, context.classification().platform(), context.content(), pagination
        );
        if (!knownPlatform) {
            return base;
        }
        return new ExtractionResult(
            base.url(), base.pageType(), base.platform(), base.title(), base.cleanedText(), base.images(),
            base.publishedDate(), base.contentHash(), ExtractionStrategy.BASE_CONTENT, base.confidence(), true,
            List.of(), pagination, DomSupport.breadcrumbs(context.document()), null, List.of()
        );
    }
}
