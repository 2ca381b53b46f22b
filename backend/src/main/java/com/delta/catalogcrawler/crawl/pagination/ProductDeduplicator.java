package com.delta.catalogcrawler.crawl.pagination;

import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Tracks products already collected. A product is new when neither its SKU nor its URL has been seen;
 * products carrying neither fall back to their lowercased name.
 */
public class ProductDeduplicator {
    private final Set<String> skus = new HashSet<>();
    private final Set<String> urls = new HashSet<>();
    private final Set<String> names = new HashSet<>();
    private int registered;

    /**
     * @return true when the product had not been seen and is now registered
     */
    public synchronized boolean register(NormalizedProduct product) {
        if (product == null) {
            return false;
        }
        String sku = key(product.sku());
        String url = product.url() == null ? null : UrlNormalizer.normalize(product.url());
        if (sku == null && url == null) {
            String name = key(product.name());
            if (name == null || !names.add(name)) {
                return false;
            }
            registered++;
            return true;
        }
        if ((sku != null && skus.contains(sku)) || (url != null && urls.contains(url))) {
            if (sku != null) {
                skus.add(sku);
            }
            if (url != null) {
                urls.add(url);
            }
            return false;
        }
        if (sku != null) {
            skus.add(sku);
        }
        if (url != null) {
            urls.add(url);
        }
        registered++;
        return true;
    }

    public synchronized int size() {
        return registered;
    }

    private static String key(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
