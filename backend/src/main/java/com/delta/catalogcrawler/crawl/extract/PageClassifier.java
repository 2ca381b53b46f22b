package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.extract.strategy.DomHeuristicsProductStrategy;
import com.delta.catalogcrawler.crawl.model.PageClassification;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.Platform;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides page type and platform from markup and URL alone. Same document and URL always give the same answer.
 */
@Component
public class PageClassifier {
    private static final List<String> PRODUCT_PATH_HINTS = List.of("/product/", "/products/", "/p/", "/item/", "/dp/");
    private static final List<String> LISTING_PATH_HINTS = List.of(
        "/category/", "/categories/", "/collections/", "/collection/", "/shop/", "/catalog/", "/product-category/"
    );
    private static final String PURCHASE_AFFORDANCE =
        "form.cart, form[action*=/cart/add], #product-addtocart-button, button[name=add-to-cart], "
            + "button.single_add_to_cart_button, [data-add-to-cart], button.add-to-cart, #add-to-cart-button";
    private static final String MICRODATA_PRODUCT = "[itemscope][itemtype*=schema.org/Product]";
    private static final Set<String> LIST_TYPES = Set.of("itemlist", "offercatalog", "collectionpage", "searchresultspage");

    private final PlatformDetector platformDetector;
    private final JsonLdReader jsonLdReader;

    public PageClassifier(PlatformDetector platformDetector, JsonLdReader jsonLdReader) {
        this.platformDetector = platformDetector;
        this.jsonLdReader = jsonLdReader;
    }

    public PageClassification classify(Document document, String url) {
        Platform platform = platformDetector.detect(document, url);
        return new PageClassification(pageType(document, url), platform);
    }

    PageType pageType(Document document, String url) {
        List<JsonNode> blocks = jsonLdReader.readBlocks(document);
        int jsonLdProducts = jsonLdReader.collectByType(blocks, JsonLdReader.PRODUCT_TYPES).size();
        boolean jsonLdList = !jsonLdReader.collectByType(blocks, LIST_TYPES).isEmpty();
        int microdataProducts = topLevelMicrodataProducts(document);
        int cards = DomHeuristicsProductStrategy.productCards(document).size();
        String path = lowerPath(url);

        if (jsonLdList || jsonLdProducts > 1) {
            return PageType.LISTING;
        }
        if (jsonLdProducts == 1 || microdataProducts == 1) {
            return PageType.PRODUCT;
        }
        if ("product".equalsIgnoreCase(metaContent(document, "og:type")) || hasStandalonePurchaseAffordance(document)) {
            return PageType.PRODUCT;
        }
        if (microdataProducts > 1 || cards >= 2) {
            return PageType.LISTING;
        }
        if (containsAny(path, PRODUCT_PATH_HINTS) && DomSupport.findPriceText(document.body() == null ? "" : document.body().text()) != null) {
            return PageType.PRODUCT;
        }
        if (containsAny(path, LISTING_PATH_HINTS) || isSearchPath(path, url)) {
            return PageType.LISTING;
        }
        if (isArticle(document, blocks)) {
            return PageType.ARTICLE;
        }
        return PageType.GENERIC;
    }

    private int topLevelMicrodataProducts(Document document) {
        int count = 0;
        for (Element scope : document.select(MICRODATA_PRODUCT)) {
            if (scope.parents().select(MICRODATA_PRODUCT).isEmpty()) {
                count++;
            }
        }
        return count;
    }

    private boolean hasStandalonePurchaseAffordance(Document document) {
        for (Element element : document.select(PURCHASE_AFFORDANCE)) {
            if (element.closest(DomHeuristicsProductStrategy.PRODUCT_CARD_SELECTOR) == null) {
                return true;
            }
        }
        return false;
    }

    private boolean isArticle(Document document, List<JsonNode> blocks) {
        if ("article".equalsIgnoreCase(metaContent(document, "og:type"))) {
            return true;
        }
        if (jsonLdReader.containsType(blocks, "article")
            || jsonLdReader.containsType(blocks, "newsarticle")
            || jsonLdReader.containsType(blocks, "blogposting")) {
            return true;
        }
        Element article = document.selectFirst("article");
        return article != null
            && (article.selectFirst("time[datetime]") != null || document.selectFirst("meta[property=article:published_time]") != null);
    }

    private boolean isSearchPath(String path, String url) {
        if (path.startsWith("/search")) {
            return true;
        }
        String lowered = url == null ? "" : url.toLowerCase(Locale.ROOT);
        return lowered.contains("?q=") || lowered.contains("&q=") || lowered.contains("?s=") || lowered.contains("&s=");
    }

    private String metaContent(Document document, String property) {
        Element meta = document.selectFirst("meta[property=" + property + "]");
        return meta == null ? null : meta.attr("content");
    }

    private static boolean containsAny(String path, List<String> hints) {
        String padded = path.endsWith("/") ? path : path + "/";
        for (String hint : hints) {
            if (padded.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static String lowerPath(String url) {
        String pathAndQuery = UrlNormalizer.pathAndQuery(url);
        if (pathAndQuery == null) {
            return "/";
        }
        int query = pathAndQuery.indexOf('?');
        String path = query >= 0 ? pathAndQuery.substring(0, query) : pathAndQuery;
        return path.toLowerCase(Locale.ROOT);
    }
}
