package com.delta.catalogcrawler.crawl.robots;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobotsRulesTest {

    @Test
    void longestMatchWinsForWildcardAgent() {
        String robots =
            """
                User-agent: *
                Disallow: /checkout
                Disallow: /private
                Allow: /private/catalog
                """;

        RobotsRules rules = RobotsRules.parse(robots, "catalogcrawler");
        assertFalse(rules.isAllowed("/private/page"));
        assertTrue(rules.isAllowed("/private/catalog/shoes"));
        assertFalse(rules.isAllowed("/checkout?step=1"));
        assertTrue(rules.isAllowed("/shop"));
    }

    @Test
    void groupNamingOurAgentOverridesWildcard() {
        String robots =
            """
                User-agent: *
                Disallow: /

                User-agent: CatalogCrawler
                Disallow: /admin
                Crawl-delay: 1.5
                """;

        RobotsRules rules = RobotsRules.parse(robots, "catalogcrawler");
        assertTrue(rules.isAllowed("/shop"));
        assertFalse(rules.isAllowed("/admin/users"));
        assertEquals(1500L, rules.getCrawlDelayMs());
    }

    @Test
    void wildcardsAndEndAnchorsAreHonoured() {
        String robots =
            """
                User-agent: *
                Disallow: /*?sort=
                Disallow: /*.json$
                """;

        RobotsRules rules = RobotsRules.parse(robots, "catalogcrawler");
        assertFalse(rules.isAllowed("/shop?sort=price"));
        assertFalse(rules.isAllowed("/feed.json"));
        assertTrue(rules.isAllowed("/feed.json.html"));
    }

    @Test
    void emptyFileAllowsEverything() {
        RobotsRules rules = RobotsRules.parse("", "catalogcrawler");

        assertTrue(rules.isAllowed("/anything"));
        assertNull(rules.getCrawlDelayMs());
    }
}
