package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainPolicyServiceTest {
    private CrawlerProperties properties;
    private DomainPolicyService service;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.setTrustedDomains(List.of("partner.example.com"));
        properties.setBlockedDomains(List.of("blocked.example.org"));
        service = new DomainPolicyService(properties);
    }

    @Test
    void normalizesRootUrl() {
        assertThat(service.validateRootUrl(" HTTPS://Shop.Example.com:443/catalog/?utm_source=x#top "))
            .isEqualTo("https://shop.example.com/catalog");
    }

    @Test
    void rejectsMissingAndMalformedUrls() {
        assertReason(() -> service.validateRootUrl(null), "missing_root_url");
        assertReason(() -> service.validateRootUrl("ftp://shop.example.com/"), "invalid_url");
        assertReason(() -> service.validateRootUrl("not a url"), "invalid_url");
        assertReason(() -> service.validateRootUrl("https://shop.example.com/" + "a".repeat(2100)), "invalid_url");
    }

    @Test
    void domainDefaultsToHostWithoutWww() {
        assertThat(service.resolveDomain("https://www.shop.example.com/", null)).isEqualTo("shop.example.com");
        assertThat(service.resolveDomain("https://eu.shop.example.com/", "shop.example.com")).isEqualTo("shop.example.com");
    }

    @Test
    void rootOutsideRequestedDomainIsRejected() {
        assertReason(() -> service.resolveDomain("https://other.example.net/", "shop.example.com"), "domain_mismatch");
        assertReason(() -> service.resolveDomain("https://shop.example.com/", "shop.example.com/path"), "invalid_domain");
    }

    @Test
    void blockedDomainsAreRejectedIncludingSubdomains() {
        assertReason(() -> service.resolveDomain("https://cdn.blocked.example.org/", null), "domain_blocked");
    }

    @Test
    void trustedClassOnlyForAllowListedDomains() {
        assertThat(service.resolveConcurrencyClass("partner.example.com", null)).isEqualTo(ConcurrencyClass.TRUSTED);
        assertThat(service.resolveConcurrencyClass("shop.example.com", null)).isEqualTo(ConcurrencyClass.STANDARD);
        assertThat(service.resolveConcurrencyClass("shop.example.com", ConcurrencyClass.TRUSTED))
            .isEqualTo(ConcurrencyClass.STANDARD);
        assertThat(service.resolveConcurrencyClass("partner.example.com", ConcurrencyClass.STANDARD))
            .isEqualTo(ConcurrencyClass.STANDARD);
    }

    private static void assertReason(Runnable call, String reasonCode) {
        assertThatThrownBy(call::run)
            .isInstanceOf(InvalidRequestException.class)
            .satisfies(e -> assertThat(((InvalidRequestException) e).getReasonCode()).isEqualTo(reasonCode));
    }
}
