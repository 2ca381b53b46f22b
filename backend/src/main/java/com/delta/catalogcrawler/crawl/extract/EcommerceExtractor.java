package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ContentExtraction;
import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.PageClassification;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PaginationHint;
import com.delta.catalogcrawler.crawl.model.Platform;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for page extraction. Classifies the page once, then hands it to the extractor registered
 * for its page type. Any rendered page yields a result: failures inside extraction degrade to base content.
 */
@Service
public class EcommerceExtractor {
    private static final Logger log = LoggerFactory.getLogger(EcommerceExtractor.class);

    private final ContentExtractor contentExtractor;
    private final PageClassifier pageClassifier;
    private final PaginationDetector paginationDetector;
    private final Map<PageType, PageExtractor> extractors = new EnumMap<>(PageType.class);

    public EcommerceExtractor(
        ContentExtractor contentExtractor,
        PageClassifier pageClassifier,
        PaginationDetector paginationDetector,
        List<PageExtractor> pageExtractors
    ) {
        this.contentExtractor = contentExtractor;
        this.pageClassifier = pageClassifier;
        this.paginationDetector = paginationDetector;
        for (PageExtractor extractor : pageExtractors) {
            for (PageType type : extractor.handles()) {
                extractors.putIfAbsent(type, extractor);
            }
        }
        for (PageType type : PageType.values()) {
            if (!extractors.containsKey(type)) {
                throw new IllegalStateException("No page extractor registered for " + type);
            }
        }
    }

    public ExtractionResult extract(String html, String url) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        ContentExtraction content = contentExtractor.extract(document);
        try {
            PageClassification classification = pageClassifier.classify(document, url);
            PaginationHint pagination = paginationDetector.detect(document, url);
            PageContext context = new PageContext(document, url, domainOf(url), classification, content);
            ExtractionResult result = extractors.get(classification.pageType()).extract(context, pagination);
            log.debug("Extracted url={} pageType={} platform={} strategy={} products={} confidence={}",
                url, result.pageType().key(), result.platform(), result.strategy().key(),
                result.products().size(), result.confidence());
            return result;
        } catch (RuntimeException e) {
            log.warn("Extraction failed, using base content url={}", url, e);
            return ExtractionResult.fromContent(url, PageType.GENERIC, Platform.UNKNOWN, content, PaginationHint.none());
        }
    }

    public static String domainOf(String url) {
        String host = UrlNormalizer.hostOf(url);
        if (host == null) {
            return "";
        }
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
