package com.delta.catalogcrawler.crawl.pagination;

import com.delta.catalogcrawler.crawl.model.Availability;
import com.delta.catalogcrawler.crawl.model.NormalizedPrice;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProductDeduplicatorTest {

    @Test
    void sameSkuOnDifferentUrlIsDuplicate() {
        ProductDeduplicator deduplicator = new ProductDeduplicator();

        assertTrue(deduplicator.register(product("Lamp", "SKU-1", "https://s.example/p/lamp")));
        assertFalse(deduplicator.register(product("Lamp", "sku-1", "https://s.example/p/lamp?color=red")));
        assertEquals(1, deduplicator.size());
    }

    @Test
    void sameUrlWithoutSkuIsDuplicate() {
        ProductDeduplicator deduplicator = new ProductDeduplicator();

        assertTrue(deduplicator.register(product("Lamp", null, "https://s.example/p/lamp/")));
        assertFalse(deduplicator.register(product("Lamp 2", null, "https://S.example/p/lamp#reviews")));
    }

    @Test
    void nameIsTheLastResortKey() {
        ProductDeduplicator deduplicator = new ProductDeduplicator();

        assertTrue(deduplicator.register(product("Desk Lamp", null, null)));
        assertFalse(deduplicator.register(product("desk lamp", null, null)));
        assertFalse(deduplicator.register(product(null, null, null)));
        assertTrue(deduplicator.register(product("Floor Lamp", null, null)));
        assertEquals(2, deduplicator.size());
    }

    private static NormalizedProduct product(String name, String sku, String url) {
        return new NormalizedProduct(
            name, NormalizedPrice.unknown(), Availability.UNKNOWN, sku, List.of(), Map.of(), url, List.of(), null
        );
    }
}
