package com.delta.catalogcrawler.crawl.extract.strategy;

import com.delta.catalogcrawler.crawl.extract.DomSupport;
import com.delta.catalogcrawler.crawl.extract.PageContext;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.Platform;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Selector and proximity heuristics for pages without structured data. Platform-specific selectors are tried
 * before the generic ones.
 */
@Component
@Order(3)
public class DomHeuristicsProductStrategy implements ProductExtractionStrategy {
    public static final String PRODUCT_CARD_SELECTOR =
        "li.product, .product-item, .product-card, article.product, .grid-item[data-product-id], "
            + "[data-product-id], .product-grid-item, .productgrid--item, .card--product";

    private static final List<String> NAME_SELECTORS = List.of(
        "h1[itemprop=name]",
        ".product-title",
        ".product-name",
        ".product_title",
        "h1[class*=product]",
        "[data-product-name]",
        "h1:not([class])",
        "h1"
    );
    private static final List<String> PRICE_SELECTORS = List.of(
        "[itemprop=price]",
        ".price-now",
        ".product-price",
        "[data-product-price]",
        ".price ins .amount",
        ".woocommerce-Price-amount",
        ".price",
        "span[class*=price]"
    );
    private static final List<String> SKU_SELECTORS = List.of(
        "[itemprop=sku]",
        ".sku",
        ".product-sku",
        "[data-product-sku]",
        "[data-sku]"
    );
    private static final List<String> AVAILABILITY_SELECTORS = List.of(
        "[itemprop=availability]",
        ".stock-status",
        ".stock",
        ".availability",
        ".in-stock",
        ".out-of-stock",
        "[data-availability]"
    );
    private static final List<String> IMAGE_SELECTORS = List.of(
        ".woocommerce-product-gallery img",
        ".product-gallery img",
        ".product__media img",
        ".product-image img",
        "img[itemprop=image]",
        "[class*=product] img"
    );
    private static final List<String> CARD_NAME_SELECTORS = List.of(
        ".woocommerce-loop-product__title",
        ".product-title",
        ".product-name",
        ".card__heading",
        "h2",
        "h3",
        "a[title]"
    );
    private static final String PURCHASE_AFFORDANCE =
        "button[name=add-to-cart], [class*=add-to-cart], [class*=add_to_cart], [class*=addtocart], "
            + "form[action*=cart] button, form[action*=cart] input[type=submit]";

    private final Map<Platform, PlatformSelectors> platformSelectors = new EnumMap<>(Platform.class);

    public DomHeuristicsProductStrategy() {
        platformSelectors.put(Platform.WOOCOMMERCE, new PlatformSelectors(
            List.of(".product_title.entry-title"),
            List.of(".summary .price ins .woocommerce-Price-amount", ".summary .price .woocommerce-Price-amount"),
            List.of(".sku_wrapper .sku")
        ));
        platformSelectors.put(Platform.SHOPIFY, new PlatformSelectors(
            List.of(".product__title h1", ".product-single__title"),
            List.of(".price-item--sale", ".price-item--regular", ".product__price", "[data-product-price]"),
            List.of(".product-single__sku", "[data-sku]")
        ));
        platformSelectors.put(Platform.MAGENTO, new PlatformSelectors(
            List.of(".page-title .base"),
            List.of(".product-info-price [data-price-type=finalPrice] .price", ".product-info-main .price"),
            List.of(".product.attribute.sku .value")
        ));
        platformSelectors.put(Platform.BIGCOMMERCE, new PlatformSelectors(
            List.of(".productView-title"),
            List.of("[data-product-price-without-tax]", ".productView-price .price--withoutTax"),
            List.of("[data-product-sku]")
        ));
        platformSelectors.put(Platform.PRESTASHOP, new PlatformSelectors(
            List.of("h1.product-title", "h1.h1"),
            List.of(".current-price [itemprop=price]", ".current-price span"),
            List.of("[itemprop=sku]", ".product-reference span")
        ));
        platformSelectors.put(Platform.SQUARESPACE, new PlatformSelectors(
            List.of(".ProductItem-details-title", ".product-title"),
            List.of(".product-price", ".ProductItem-product-price"),
            List.of()
        ));
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.DOM_HEURISTICS;
    }

    @Override
    public Optional<RawProduct> extractProduct(PageContext context) {
        Document document = context.document();
        Platform platform = context.classification().platform();
        PlatformSelectors specific = platformSelectors.get(platform);

        String name = specific == null ? null : DomSupport.firstText(document, specific.name());
        if (name == null) {
            name = DomSupport.firstText(document, NAME_SELECTORS);
        }
        String price = specific == null ? null : priceText(document, specific.price());
        if (price == null) {
            price = priceNearPurchaseAffordance(document);
        }
        if (price == null) {
            price = priceText(document, PRICE_SELECTORS);
        }
        String sku = specific == null ? null : DomSupport.firstText(document, specific.sku());
        if (sku == null) {
            sku = DomSupport.firstText(document, SKU_SELECTORS);
        }
        if (sku == null) {
            sku = DomSupport.findSkuText(document.body() == null ? null : document.body().text());
        }
        if (name == null && price == null && sku == null) {
            return Optional.empty();
        }
        return Optional.of(new RawProduct(
            name,
            price,
            availabilityText(document),
            sku,
            UrlNormalizer.normalize(context.url()),
            null,
            null,
            DomSupport.images(document, IMAGE_SELECTORS),
            List.of(),
            List.of()
        ));
    }

    @Override
    public List<RawProduct> extractListing(PageContext context) {
        List<RawProduct> out = new ArrayList<>();
        for (Element card : productCards(context.document())) {
            String name = DomSupport.firstText(card, CARD_NAME_SELECTORS);
            if (name == null) {
                Element titled = card.selectFirst("a[title]");
                name = titled == null ? null : titled.attr("title");
            }
            String url = DomSupport.absoluteLink(card, context.url());
            if (name == null && url == null) {
                continue;
            }
            String price = priceText(card, PRICE_SELECTORS);
            if (price == null) {
                price = DomSupport.findPriceText(card.text());
            }
            String sku = DomSupport.firstNonBlank(card.attr("data-product-sku"), card.attr("data-sku"));
            if (sku == null) {
                sku = DomSupport.firstText(card, SKU_SELECTORS);
            }
            out.add(new RawProduct(
                name,
                price,
                cardAvailability(card),
                sku,
                url,
                null,
                null,
                DomSupport.images(card, List.of("img")),
                List.of(),
                List.of()
            ));
        }
        return out;
    }

    public static List<Element> productCards(Element root) {
        List<Element> out = new ArrayList<>();
        for (Element card : root.select(PRODUCT_CARD_SELECTOR)) {
            boolean nested = false;
            for (Element existing : out) {
                if (card.parents().contains(existing)) {
                    nested = true;
                    break;
                }
            }
            if (!nested && !card.is("body")) {
                out.add(card);
            }
        }
        return out;
    }

    private String priceText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            for (Element element : root.select(selector)) {
                String content = element.attr("content");
                if (!content.isBlank()) {
                    String currency = currencyNear(element);
                    return currency == null ? content.trim() : content.trim() + " " + currency;
                }
                String dataPrice = element.attr("data-product-price");
                String text = DomSupport.firstNonBlank(DomSupport.findPriceText(element.text()), dataPrice, element.text());
                if (text != null && text.chars().anyMatch(Character::isDigit)) {
                    return text.trim();
                }
            }
        }
        return null;
    }

    private String currencyNear(Element priceElement) {
        Element scope = priceElement.parent();
        for (int depth = 0; scope != null && depth < 3; depth++, scope = scope.parent()) {
            Element currency = scope.selectFirst("[itemprop=priceCurrency]");
            if (currency != null) {
                return DomSupport.firstNonBlank(currency.attr("content"), currency.text());
            }
        }
        return null;
    }

    /**
     * Looks for price text in the containers around an add-to-cart control, closest first.
     */
    private String priceNearPurchaseAffordance(Document document) {
        Element affordance = document.selectFirst(PURCHASE_AFFORDANCE);
        if (affordance == null) {
            for (Element button : document.select("button, a.button, input[type=submit]")) {
                String label = DomSupport.firstNonBlank(button.text(), button.attr("value"));
                if (label != null && label.toLowerCase(Locale.ROOT).matches(".*\\badd to (cart|basket|bag)\\b.*")) {
                    affordance = button;
                    break;
                }
            }
        }
        if (affordance == null) {
            return null;
        }
        Element scope = affordance.parent();
        for (int depth = 0; scope != null && depth < 4; depth++, scope = scope.parent()) {
            String price = priceText(scope, List.of("[itemprop=price]", ".price", "[class*=price]"));
            if (price == null) {
                price = DomSupport.findPriceText(scope.ownText());
            }
            if (price != null) {
                return price;
            }
        }
        return null;
    }

    private String availabilityText(Document document) {
        for (String selector : AVAILABILITY_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String value = DomSupport.firstNonBlank(
                element.attr("href"),
                element.attr("content"),
                element.attr("data-availability"),
                element.text()
            );
            if (value == null && element.hasClass("out-of-stock")) {
                value = "out of stock";
            } else if (value == null && element.hasClass("in-stock")) {
                value = "in stock";
            }
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String cardAvailability(Element card) {
        if (card.hasClass("outofstock") || card.hasClass("out-of-stock") || card.selectFirst(".out-of-stock, .sold-out") != null) {
            return "out of stock";
        }
        if (card.hasClass("instock") || card.hasClass("in-stock")) {
            return "in stock";
        }
        Element stock = card.selectFirst(".stock, .availability, [data-availability]");
        return stock == null ? null : DomSupport.firstNonBlank(stock.attr("data-availability"), stock.text());
    }

    private record PlatformSelectors(List<String> name, List<String> price, List<String> sku) {
    }
}
