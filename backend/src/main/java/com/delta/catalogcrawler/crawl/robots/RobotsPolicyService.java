package com.delta.catalogcrawler.crawl.robots;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.RenderOptions;
import com.delta.catalogcrawler.crawl.model.RenderResult;
import com.delta.catalogcrawler.crawl.render.PageRenderer;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsPolicyService {
    private static final Logger log = LoggerFactory.getLogger(RobotsPolicyService.class);
    private static final int MAX_CACHED_HOSTS = 4096;

    private final CrawlerProperties properties;
    private final PageRenderer renderer;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsPolicyService(CrawlerProperties properties, PageRenderer renderer) {
        this.properties = properties;
        this.renderer = renderer;
    }

    /**
     * Whether robots.txt lets us fetch {@code url}. Trusted domains and a disabled robots check always pass.
     */
    public boolean isAllowed(String url, ConcurrencyClass concurrencyClass) {
        if (!properties.getRobots().isEnabled() || concurrencyClass == ConcurrencyClass.TRUSTED) {
            return true;
        }
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        return rulesFor(uri).isAllowed(UrlNormalizer.pathAndQuery(url));
    }

    RobotsRules rulesFor(URI uri) {
        String origin = origin(uri);
        RobotsRules cached = cache.get(origin);
        if (cached != null) {
            return cached;
        }
        if (cache.size() >= MAX_CACHED_HOSTS) {
            cache.clear();
        }
        return cache.computeIfAbsent(origin, this::loadRules);
    }

    private RobotsRules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        RenderResult fetch = renderer.render(
            robotsUrl,
            new RenderOptions(true, Duration.ofSeconds(properties.getRender().getTimeoutSeconds()), ConcurrencyClass.STANDARD)
        );
        if (fetch.statusCode() >= 400 && fetch.statusCode() < 500) {
            // no robots.txt published
            return RobotsRules.allowAll();
        }
        if (!fetch.isSuccessful()) {
            boolean failOpen = properties.getRobots().isFailOpen();
            log.warn("robots fetch failed origin={} status={} errorCode={} decision={}",
                origin, fetch.statusCode(), fetch.errorCode(), failOpen ? "allow_all" : "disallow_all");
            return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
        }
        RobotsRules rules = RobotsRules.parse(fetch.html(), agentToken());
        log.debug("Loaded robots origin={} crawlDelayMs={}", origin, rules.getCrawlDelayMs());
        return rules;
    }

    private String agentToken() {
        String userAgent = CrawlerProperties.normalizeUserAgent(properties.getUserAgent());
        int slash = userAgent.indexOf('/');
        String token = slash > 0 ? userAgent.substring(0, slash) : userAgent.split("\\s+")[0];
        return token.toLowerCase(Locale.ROOT);
    }

    private static String origin(URI uri) {
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() > 0 ? scheme + "://" + host + ":" + uri.getPort() : scheme + "://" + host;
    }
}
