package com.delta.catalogcrawler.crawl.pagination;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.CrawlException;
import com.delta.catalogcrawler.crawl.error.TransientFetchException;
import com.delta.catalogcrawler.crawl.extract.EcommerceExtractor;
import com.delta.catalogcrawler.crawl.model.CatalogCrawlOptions;
import com.delta.catalogcrawler.crawl.model.CatalogCrawlResult;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.FailureLedgerEntry;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.RenderResult;
import com.delta.catalogcrawler.crawl.normalize.ProductNormalizer;
import com.delta.catalogcrawler.crawl.queue.RetryPolicy;
import com.delta.catalogcrawler.crawl.render.PageFetcher;
import com.delta.catalogcrawler.crawl.service.DomainPolicyService;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Walks a paginated catalog one page at a time. The next page is requested only after the current page has been
 * extracted, so the stall counter always reflects pages in order.
 */
@Service
public class PaginationCrawler {
    private static final Logger log = LoggerFactory.getLogger(PaginationCrawler.class);

    private final PageFetcher pageFetcher;
    private final EcommerceExtractor extractor;
    private final ProductNormalizer normalizer;
    private final RetryPolicy retryPolicy;
    private final DomainPolicyService domainPolicyService;
    private final CrawlerProperties properties;

    public PaginationCrawler(
        PageFetcher pageFetcher,
        EcommerceExtractor extractor,
        ProductNormalizer normalizer,
        RetryPolicy retryPolicy,
        DomainPolicyService domainPolicyService,
        CrawlerProperties properties
    ) {
        this.pageFetcher = pageFetcher;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.retryPolicy = retryPolicy;
        this.domainPolicyService = domainPolicyService;
        this.properties = properties;
    }

    public CatalogCrawlResult crawlCatalog(String startUrl, CatalogCrawlOptions options) {
        String url = domainPolicyService.validateRootUrl(startUrl);
        String domain = domainPolicyService.resolveDomain(url, null);
        ConcurrencyClass concurrencyClass = domainPolicyService.resolveConcurrencyClass(domain, null);
        boolean trusted = concurrencyClass == ConcurrencyClass.TRUSTED;
        CatalogTraversal traversal = new CatalogTraversal(
            options.maxPages(),
            options.followPagination(),
            properties.getPagination().getStallPageLimit(),
            domain
        );
        List<FailureLedgerEntry> errors = new ArrayList<>();
        log.info("Catalog crawl started url={} maxPages={} followPagination={} trusted={}",
            url, options.maxPages(), options.followPagination(), trusted);

        while (url != null) {
            Optional<RenderResult> page = fetchWithRetry(url, concurrencyClass, errors);
            if (page.isEmpty()) {
                traversal.onPageFailed(url);
                break;
            }
            RenderResult render = page.get();
            ExtractionResult result = extractor.extract(render.html(), render.finalUrlOrRequested());
            List<NormalizedProduct> products = normalize(result.products());
            Optional<String> next = traversal.onPageCompleted(url, products, result.pagination());
            log.debug("Catalog page done url={} products={} next={}", url, products.size(), next.orElse(null));
            if (next.isEmpty()) {
                break;
            }
            if (!trusted && !pause(properties.getPagination().getInterPageDelayMs())) {
                traversal.cancel();
                break;
            }
            url = next.get();
        }

        log.info("Catalog crawl finished pagesVisited={} products={} reason={}",
            traversal.pagesVisited(), traversal.products().size(), traversal.stopReason().description());
        return new CatalogCrawlResult(traversal.products(), traversal.pagesVisited(), traversal.stopReason(), errors);
    }

    private Optional<RenderResult> fetchWithRetry(String url, ConcurrencyClass concurrencyClass, List<FailureLedgerEntry> errors) {
        for (int attempt = 1; ; attempt++) {
            try {
                return Optional.of(pageFetcher.fetch(url, concurrencyClass));
            } catch (TransientFetchException e) {
                boolean interrupted = FailureReasonClassifier.INTERRUPTED.equals(e.getReasonCode());
                if (!interrupted && retryPolicy.shouldRetry(e.getReasonCode(), attempt)) {
                    log.warn("Catalog page retry url={} attempt={} reason={}", url, attempt, e.getReasonCode());
                    if (retryPolicy.sleepBackoff(attempt)) {
                        continue;
                    }
                }
                errors.add(ledgerEntry(url, e, attempt));
                return Optional.empty();
            } catch (CrawlException e) {
                log.warn("Catalog page failed url={} reason={}", url, e.getReasonCode());
                errors.add(ledgerEntry(url, e, attempt));
                return Optional.empty();
            }
        }
    }

    private List<NormalizedProduct> normalize(List<RawProduct> raw) {
        List<NormalizedProduct> out = new ArrayList<>(raw.size());
        for (RawProduct product : raw) {
            out.add(normalizer.normalize(product));
        }
        return out;
    }

    /**
     * Retries are exhausted by the time a failure is recorded, so transient failures are recorded as terminal.
     */
    private FailureLedgerEntry ledgerEntry(String url, CrawlException e, int attempts) {
        return new FailureLedgerEntry(
            url,
            e.getKind() == CrawlErrorKind.TRANSIENT_FETCH ? CrawlErrorKind.TERMINAL_FETCH : e.getKind(),
            e.getReasonCode(),
            e.getMessage(),
            attempts,
            Instant.now()
        );
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delayMs);
            return true;
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
