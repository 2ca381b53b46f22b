package com.delta.catalogcrawler.crawl.extract.strategy;

import com.delta.catalogcrawler.crawl.extract.DomSupport;
import com.delta.catalogcrawler.crawl.extract.PageContext;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.RawVariant;
import com.delta.catalogcrawler.crawl.model.SpecEntry;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Inline schema.org markup: microdata ({@code itemscope/itemprop}) and RDFa Lite ({@code typeof/property}).
 */
@Component
@Order(2)
public class MicrodataProductStrategy implements ProductExtractionStrategy {
    private static final String MICRODATA_SCOPE = "[itemscope][itemtype*=schema.org/Product]";
    private static final Set<String> LINK_PROPERTIES = Set.of("url", "availability", "image", "sameAs");

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.MICRODATA;
    }

    @Override
    public Optional<RawProduct> extractProduct(PageContext context) {
        List<RawProduct> products = extractAll(context);
        RawProduct best = null;
        for (RawProduct product : products) {
            if (best == null || product.rawPrice() != null && best.rawPrice() == null) {
                best = product;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public List<RawProduct> extractListing(PageContext context) {
        return extractAll(context);
    }

    private List<RawProduct> extractAll(PageContext context) {
        List<RawProduct> out = new ArrayList<>();
        for (Element scope : context.document().select(MICRODATA_SCOPE)) {
            if (hasEnclosingProductScope(scope, "itemscope")) {
                continue;
            }
            out.add(toRawProduct(scope, context.url(), "itemprop", "itemscope"));
        }
        for (Element scope : context.document().select("[typeof]")) {
            if (!isRdfaProduct(scope.attr("typeof")) || hasEnclosingProductScope(scope, "typeof")) {
                continue;
            }
            out.add(toRawProduct(scope, context.url(), "property", "typeof"));
        }
        return out;
    }

    private RawProduct toRawProduct(Element scope, String pageUrl, String propAttr, String scopeAttr) {
        String name = property(scope, propAttr, scopeAttr, "name");
        String price = property(scope, propAttr, scopeAttr, "price");
        if (price == null) {
            price = property(scope, propAttr, scopeAttr, "lowPrice");
        }
        String currency = property(scope, propAttr, scopeAttr, "priceCurrency");
        String rawPrice = price == null ? null : currency == null ? price : price + " " + currency;

        Set<String> images = new LinkedHashSet<>();
        for (Element image : propertyElements(scope, propAttr, scopeAttr, "image")) {
            String src = DomSupport.imageSource(image);
            if (src != null) {
                images.add(src);
            }
        }

        List<SpecEntry> specs = new ArrayList<>();
        for (Element additional : propertyElements(scope, propAttr, scopeAttr, "additionalProperty")) {
            String key = valueOf(additional.selectFirst("[" + propAttr + "=name]"), "name");
            String value = valueOf(additional.selectFirst("[" + propAttr + "=value]"), "value");
            if (key != null && value != null) {
                specs.add(new SpecEntry(key, value));
            }
        }

        List<RawVariant> variants = new ArrayList<>();
        List<Element> offers = propertyElements(scope, propAttr, scopeAttr, "offers");
        if (offers.size() > 1) {
            for (Element offer : offers) {
                String offerPrice = valueOf(offer.selectFirst("[" + propAttr + "=price]"), "price");
                String offerCurrency = valueOf(offer.selectFirst("[" + propAttr + "=priceCurrency]"), "priceCurrency");
                variants.add(new RawVariant(
                    valueOf(offer.selectFirst("[" + propAttr + "=sku]"), "sku"),
                    offerPrice == null ? null : offerCurrency == null ? offerPrice : offerPrice + " " + offerCurrency,
                    valueOf(offer.selectFirst("[" + propAttr + "=availability]"), "availability"),
                    Map.of()
                ));
            }
        }

        String url = property(scope, propAttr, scopeAttr, "url");
        return new RawProduct(
            name,
            rawPrice,
            property(scope, propAttr, scopeAttr, "availability"),
            DomSupport.firstNonBlank(property(scope, propAttr, scopeAttr, "sku"), property(scope, propAttr, scopeAttr, "mpn")),
            url == null ? UrlNormalizer.normalize(pageUrl) : UrlNormalizer.resolve(pageUrl, url),
            property(scope, propAttr, scopeAttr, "brand"),
            property(scope, propAttr, scopeAttr, "description"),
            new ArrayList<>(images),
            variants,
            specs
        );
    }

    private String property(Element scope, String propAttr, String scopeAttr, String name) {
        for (Element element : propertyElements(scope, propAttr, scopeAttr, name)) {
            String value = valueOf(element, name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Elements carrying {@code name} that belong to this product, directly or through its offers.
     */
    private List<Element> propertyElements(Element scope, String propAttr, String scopeAttr, String name) {
        List<Element> out = new ArrayList<>();
        Elements candidates = scope.select("[" + propAttr + "]");
        for (Element candidate : candidates) {
            if (!hasToken(candidate.attr(propAttr), name)) {
                continue;
            }
            Element owner = owningScope(candidate, scopeAttr);
            if (owner == scope) {
                out.add(candidate);
                continue;
            }
            if (owner != null && owner.attr(propAttr).contains("offers") && owningScope(owner, scopeAttr) == scope) {
                out.add(candidate);
            }
        }
        return out;
    }

    private Element owningScope(Element element, String scopeAttr) {
        for (Element parent : element.parents()) {
            if (parent.hasAttr(scopeAttr)) {
                return parent;
            }
        }
        return null;
    }

    private boolean hasEnclosingProductScope(Element scope, String scopeAttr) {
        for (Element parent : scope.parents()) {
            if (!parent.hasAttr(scopeAttr)) {
                continue;
            }
            String type = "itemscope".equals(scopeAttr) ? parent.attr("itemtype") : parent.attr("typeof");
            if (type.contains("Product")) {
                return true;
            }
        }
        return false;
    }

    private String valueOf(Element element, String name) {
        if (element == null) {
            return null;
        }
        boolean nestedScope = element.hasAttr("itemscope") || element.hasAttr("typeof");
        String value = element.attr("content");
        if (value.isBlank() && LINK_PROPERTIES.contains(name)) {
            value = DomSupport.firstNonBlank(element.attr("href"), element.attr("src"));
        }
        if (value == null || value.isBlank()) {
            value = DomSupport.firstNonBlank(element.attr("datetime"), element.attr("value"));
        }
        if (value == null || value.isBlank()) {
            Element nestedName = nestedScope ? element.selectFirst("[itemprop=name], [property=name]") : null;
            value = nestedName != null ? nestedName.text() : element.text();
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean hasToken(String attributeValue, String token) {
        for (String part : attributeValue.trim().split("\\s+")) {
            String local = part.contains(":") ? part.substring(part.lastIndexOf(':') + 1) : part;
            if (local.equals(token)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isRdfaProduct(String typeOf) {
        return hasToken(typeOf, "Product");
    }
}
