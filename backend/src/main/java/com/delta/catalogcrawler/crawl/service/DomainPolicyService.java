package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * URL and domain rules applied before any crawl starts.
 */
@Service
public class DomainPolicyService {
    private static final Logger log = LoggerFactory.getLogger(DomainPolicyService.class);
    private static final int MAX_URL_LENGTH = 2048;

    private final CrawlerProperties properties;

    public DomainPolicyService(CrawlerProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the normalized root URL
     * @throws InvalidRequestException when the URL is not an absolute http(s) URL with a host
     */
    public String validateRootUrl(String rootUrl) {
        if (rootUrl == null || rootUrl.isBlank()) {
            throw new InvalidRequestException("missing_root_url", "rootUrl is required");
        }
        if (rootUrl.length() > MAX_URL_LENGTH) {
            throw new InvalidRequestException("invalid_url", "rootUrl exceeds " + MAX_URL_LENGTH + " characters");
        }
        String normalized = UrlNormalizer.normalize(rootUrl);
        if (normalized == null) {
            throw new InvalidRequestException("invalid_url", "rootUrl must be an absolute http(s) URL: " + rootUrl);
        }
        return normalized;
    }

    /**
     * Domain scope of a crawl: the requested domain when given, otherwise the root host without {@code www.}.
     * The root host must fall inside that scope and the scope must not be blocked.
     */
    public String resolveDomain(String normalizedRootUrl, String requestedDomain) {
        String host = UrlNormalizer.hostOf(normalizedRootUrl);
        String domain = requestedDomain == null || requestedDomain.isBlank()
            ? stripWww(host)
            : stripWww(requestedDomain.trim().toLowerCase(Locale.ROOT));
        if (domain == null || domain.isBlank() || domain.contains("/") || domain.contains(" ")) {
            throw new InvalidRequestException("invalid_domain", "domain is malformed: " + requestedDomain);
        }
        if (!UrlNormalizer.isWithinDomain(host, domain)) {
            throw new InvalidRequestException("domain_mismatch", "rootUrl host " + host + " is outside domain " + domain);
        }
        if (isBlocked(host) || isBlocked(domain)) {
            throw new InvalidRequestException("domain_blocked", "domain is not allowed: " + domain);
        }
        return domain;
    }

    public boolean isTrusted(String hostOrDomain) {
        return matchesAny(hostOrDomain, properties.getTrustedDomains());
    }

    public boolean isBlocked(String hostOrDomain) {
        return matchesAny(hostOrDomain, properties.getBlockedDomains());
    }

    /**
     * Trusted capacity is only granted to allow-listed domains; a request asking for it on any other
     * domain runs as standard.
     */
    public ConcurrencyClass resolveConcurrencyClass(String domain, ConcurrencyClass requested) {
        boolean trusted = isTrusted(domain);
        if (requested == null) {
            return trusted ? ConcurrencyClass.TRUSTED : ConcurrencyClass.STANDARD;
        }
        if (requested == ConcurrencyClass.TRUSTED && !trusted) {
            log.warn("Trusted concurrency requested for non-trusted domain={}, downgrading to standard", domain);
            return ConcurrencyClass.STANDARD;
        }
        return requested;
    }

    private static boolean matchesAny(String hostOrDomain, List<String> domains) {
        if (hostOrDomain == null || hostOrDomain.isBlank()) {
            return false;
        }
        for (String domain : domains) {
            if (UrlNormalizer.isWithinDomain(hostOrDomain, domain)) {
                return true;
            }
        }
        return false;
    }

    private static String stripWww(String host) {
        if (host == null) {
            return null;
        }
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
