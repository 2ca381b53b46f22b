package com.delta.catalogcrawler.crawl.sitemap;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.FetchedBytes;
import com.delta.catalogcrawler.crawl.model.SitemapDiscoveryResult;
import com.delta.catalogcrawler.crawl.model.SitemapUrlEntry;
import com.delta.catalogcrawler.crawl.render.HttpPageRenderer;
import com.delta.catalogcrawler.crawl.robots.RobotsPolicyService;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Reads sitemaps and sitemap indexes (plain or gzipped) breadth-first and collects the page URLs they list.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final String ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final HttpPageRenderer renderer;
    private final RobotsPolicyService robotsPolicyService;
    private final CrawlerProperties properties;

    public SitemapService(HttpPageRenderer renderer, RobotsPolicyService robotsPolicyService, CrawlerProperties properties) {
        this.renderer = renderer;
        this.robotsPolicyService = robotsPolicyService;
        this.properties = properties;
    }

    public SitemapDiscoveryResult discover(List<String> seedSitemaps, ConcurrencyClass concurrencyClass, int maxUrls) {
        CrawlerProperties.Sitemap config = properties.getSitemap();
        int maxDepth = config.getMaxDepth();
        int maxSitemaps = config.getMaxSitemaps();

        ArrayDeque<SitemapTask> pending = new ArrayDeque<>();
        for (String seed : seedSitemaps) {
            String normalized = UrlNormalizer.normalize(seed);
            if (normalized != null) {
                pending.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashSet<String> visited = new LinkedHashSet<>();
        LinkedHashMap<String, String> discovered = new LinkedHashMap<>();
        List<String> fetched = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        while (!pending.isEmpty() && visited.size() < maxSitemaps && discovered.size() < maxUrls) {
            SitemapTask current = pending.removeFirst();
            if (current.depth() > maxDepth || !visited.add(current.url())) {
                continue;
            }
            if (!robotsPolicyService.isAllowed(current.url(), concurrencyClass)) {
                log.debug("Sitemap blocked by robots: {}", current.url());
                increment(errors, "blocked_by_robots");
                continue;
            }

            FetchedBytes fetch = renderer.fetchBytes(current.url(), ACCEPT, config.getMaxBytes());
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = decode(current.url(), fetch);
            } catch (IOException e) {
                log.debug("Sitemap gzip decode failed url={}", current.url(), e);
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            if (current.depth() < maxDepth) {
                for (Element loc : xml.select("sitemap > loc")) {
                    String child = UrlNormalizer.normalize(loc.text());
                    if (child != null && !visited.contains(child) && visited.size() + pending.size() < maxSitemaps) {
                        pending.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }
            for (Element urlElement : xml.select("url")) {
                Element locElement = urlElement.selectFirst("loc");
                String loc = locElement == null ? null : UrlNormalizer.normalize(locElement.text());
                if (loc == null || discovered.containsKey(loc) || discovered.size() >= maxUrls) {
                    continue;
                }
                Element lastmodElement = urlElement.selectFirst("lastmod");
                discovered.put(loc, lastmodElement == null ? null : lastmodElement.text().trim());
            }
            fetched.add(current.url());
        }

        List<SitemapUrlEntry> entries = discovered.entrySet().stream()
            .map(entry -> new SitemapUrlEntry(entry.getKey(), entry.getValue()))
            .toList();
        log.debug("Sitemap discovery seeds={} sitemaps={} urls={} errors={}", seedSitemaps, fetched.size(), entries.size(), errors);
        return new SitemapDiscoveryResult(List.copyOf(fetched), entries, Map.copyOf(errors));
    }

    private static String errorKey(FetchedBytes fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private static void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private static String decode(String sitemapUrl, FetchedBytes fetch) throws IOException {
        byte[] body = fetch.body();
        if (isGzip(sitemapUrl, fetch, body)) {
            try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(body))) {
                return new String(gzip.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * HttpClient never decompresses, so a gzip Content-Encoding still means gzipped bytes here.
     */
    private static boolean isGzip(String sitemapUrl, FetchedBytes fetch, byte[] body) {
        String requested = sitemapUrl.toLowerCase(Locale.ROOT);
        String resolved = fetch.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        if (requested.endsWith(".gz") || resolved.endsWith(".gz")) {
            return true;
        }
        if (fetch.contentEncoding() != null && fetch.contentEncoding().toLowerCase(Locale.ROOT).contains("gzip")) {
            return true;
        }
        return body.length >= 2 && (body[0] & 0xFF) == 0x1f && (body[1] & 0xFF) == 0x8b;
    }

    private record SitemapTask(String url, int depth) {
    }
}
