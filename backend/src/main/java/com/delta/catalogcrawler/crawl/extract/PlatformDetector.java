package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.Platform;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class PlatformDetector {
    private static final String PRODUCT_SIGNALS =
        "[itemtype*=schema.org/Product], [data-product-id], .product-price, [class*=add-to-cart], "
            + "button[name=add-to-cart], form[action*=cart]";

    public Platform detect(Document document, String url) {
        if (document == null) {
            return Platform.UNKNOWN;
        }
        Platform byMarkup = detectFromMarkup(document);
        if (byMarkup != Platform.UNKNOWN) {
            return byMarkup;
        }
        Platform byHost = detectFromHost(url);
        if (byHost != Platform.UNKNOWN) {
            return byHost;
        }
        if (hasProductSignals(document)) {
            return Platform.GENERIC_ECOMMERCE;
        }
        return Platform.UNKNOWN;
    }

    Platform detectFromMarkup(Document document) {
        if (!document.select(
            "body.woocommerce, body[class*=woocommerce], meta[name=generator][content*=WooCommerce], .woocommerce-product, "
                + "link[href*=/wp-content/plugins/woocommerce]"
        ).isEmpty()) {
            return Platform.WOOCOMMERCE;
        }
        if (!document.select(
            "meta[name=shopify-digital-wallet], script[src*=cdn.shopify.com], link[href*=cdn.shopify.com], "
                + "#shopify-features, .shopify-section"
        ).isEmpty()) {
            return Platform.SHOPIFY;
        }
        if (!document.select(
            "body[class*=catalog-product], body[class*=catalog-category], script[src*=/static/version], "
                + "script[type=text/x-magento-init], .magento-init"
        ).isEmpty()) {
            return Platform.MAGENTO;
        }
        if (!document.select(
            "script[src*=bigcommerce.com], link[href*=bigcommerce.com], [data-content-region], body[data-bc-page-type]"
        ).isEmpty()) {
            return Platform.BIGCOMMERCE;
        }
        if (!document.select(
            "meta[name=generator][content*=PrestaShop], body#product[class*=page-product], "
                + "script[src*=/modules/ps_]"
        ).isEmpty()) {
            return Platform.PRESTASHOP;
        }
        if (!document.select(
            "script[src*=static1.squarespace.com], link[href*=squarespace], .sqs-block, meta[name=generator][content*=Squarespace]"
        ).isEmpty()) {
            return Platform.SQUARESPACE;
        }
        String generator = document.select("meta[name=generator]").attr("content").toLowerCase(Locale.ROOT);
        if (generator.contains("woocommerce")) {
            return Platform.WOOCOMMERCE;
        }
        return Platform.UNKNOWN;
    }

    Platform detectFromHost(String url) {
        if (url == null || url.isBlank()) {
            return Platform.UNKNOWN;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains(".myshopify.com")) {
            return Platform.SHOPIFY;
        }
        if (lower.contains(".mybigcommerce.com")) {
            return Platform.BIGCOMMERCE;
        }
        if (lower.contains(".squarespace.com")) {
            return Platform.SQUARESPACE;
        }
        return Platform.UNKNOWN;
    }

    private boolean hasProductSignals(Document document) {
        if (!document.select(PRODUCT_SIGNALS).isEmpty()) {
            return true;
        }
        for (Element script : document.select("script[type=application/ld+json]")) {
            String data = script.data().toLowerCase(Locale.ROOT);
            if (data.contains("\"product\"") || data.contains("\"itemlist\"") || data.contains("\"offer\"")) {
                return true;
            }
        }
        return false;
    }
}
