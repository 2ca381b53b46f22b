package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.extract.strategy.DomHeuristicsProductStrategy;
import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PaginationHint;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class ListingPageExtractor implements PageExtractor {
    private static final String RESULT_COUNT_SELECTOR =
        ".woocommerce-result-count, .toolbar-amount, .collection__products-count, .results-count, "
            + ".product-count, .search-results-count, [data-total-products]";

    private final StrategyChainRunner chainRunner;

    public ListingPageExtractor(StrategyChainRunner chainRunner) {
        this.chainRunner = chainRunner;
    }

    @Override
    public Set<PageType> handles() {
        return EnumSet.of(PageType.LISTING);
    }

    @Override
    public ExtractionResult extract(PageContext context, PaginationHint pagination) {
        StrategyRun run = chainRunner.runListing(context);
        List<RawProduct> products = run == null ? List.of() : run.products();
        boolean knownPlatform = context.classification().platform().isKnownPlatform();
        if (products.isEmpty() && !knownPlatform && !pagination.hasNext()) {
            return ExtractionResult.fromContent(
                context.url(), PageType.GENERIC, context.classification().platform(), context.content(), pagination
            );
        }
        boolean lowConfidence = run == null || !run.sufficient();
        return new ExtractionResult(
            context.url(),
            PageType.LISTING,
            context.classification().platform(),
            context.content().title(),
            context.content().cleanedText(),
            context.content().images(),
            context.content().publishedDate(),
            context.content().contentHash(),
            products.isEmpty() ? ExtractionStrategy.BASE_CONTENT : run.strategy(),
            products.isEmpty() ? 0.0 : run.confidence(),
            lowConfidence,
            products,
            pagination,
            DomSupport.breadcrumbs(context.document()),
            totalProducts(context.document()),
            productLinks(context, products)
        );
    }

    private List<String> productLinks(PageContext context, List<RawProduct> products) {
        String pageUrl = UrlNormalizer.normalize(context.url());
        Set<String> links = new LinkedHashSet<>();
        for (RawProduct product : products) {
            addLink(links, product.url(), pageUrl, context.domain());
        }
        for (Element card : DomHeuristicsProductStrategy.productCards(context.document())) {
            addLink(links, DomSupport.absoluteLink(card, context.url()), pageUrl, context.domain());
        }
        return new ArrayList<>(links);
    }

    private void addLink(Set<String> links, String candidate, String pageUrl, String domain) {
        String normalized = UrlNormalizer.normalize(candidate);
        if (normalized == null || normalized.equals(pageUrl)) {
            return;
        }
        if (UrlNormalizer.isWithinDomain(UrlNormalizer.hostOf(normalized), domain)) {
            links.add(normalized);
        }
    }

    private Integer totalProducts(Document document) {
        Element counter = document.selectFirst(RESULT_COUNT_SELECTOR);
        if (counter != null) {
            String attribute = counter.attr("data-total-products");
            if (!attribute.isBlank() && attribute.chars().allMatch(Character::isDigit)) {
                return Integer.parseInt(attribute);
            }
            Integer count = DomSupport.findTotalCount(counter.text());
            if (count != null) {
                return count;
            }
        }
        return null;
    }
}
