package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.crawl.error.CrawlException;
import com.delta.catalogcrawler.crawl.error.PersistenceUnavailableException;
import com.delta.catalogcrawler.crawl.error.TransientFetchException;
import com.delta.catalogcrawler.crawl.extract.EcommerceExtractor;
import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.FetchTask;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.RenderResult;
import com.delta.catalogcrawler.crawl.model.SitemapDiscoveryResult;
import com.delta.catalogcrawler.crawl.model.SitemapUrlEntry;
import com.delta.catalogcrawler.crawl.model.TaskState;
import com.delta.catalogcrawler.crawl.normalize.ProductNormalizer;
import com.delta.catalogcrawler.crawl.persistence.CrawlStore;
import com.delta.catalogcrawler.crawl.render.PageFetcher;
import com.delta.catalogcrawler.crawl.service.CrawlJob;
import com.delta.catalogcrawler.crawl.sitemap.SitemapService;
import com.delta.catalogcrawler.crawl.service.JobRegistry;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one task taken from the queue: fetch, extract, normalize, store, then schedule follow-up pages.
 * Sitemap tasks instead queue the pages the sitemap lists.
 * Every path resolves the task exactly once, either back to the queue for a retry or to a final state.
 */
@Component
public class FetchTaskProcessor {
    private static final Logger log = LoggerFactory.getLogger(FetchTaskProcessor.class);

    private final FetchTaskQueue queue;
    private final JobRegistry registry;
    private final JobCoordinator coordinator;
    private final PageFetcher pageFetcher;
    private final EcommerceExtractor extractor;
    private final ProductNormalizer normalizer;
    private final RetryPolicy retryPolicy;
    private final CrawlStore store;
    private final SitemapService sitemapService;

    public FetchTaskProcessor(
        FetchTaskQueue queue,
        JobRegistry registry,
        JobCoordinator coordinator,
        PageFetcher pageFetcher,
        EcommerceExtractor extractor,
        ProductNormalizer normalizer,
        RetryPolicy retryPolicy,
        CrawlStore store,
        SitemapService sitemapService
    ) {
        this.queue = queue;
        this.registry = registry;
        this.coordinator = coordinator;
        this.pageFetcher = pageFetcher;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.retryPolicy = retryPolicy;
        this.store = store;
        this.sitemapService = sitemapService;
    }

    public void process(FetchTask task) {
        Optional<CrawlJob> found = registry.find(task.getJobId());
        if (found.isEmpty()) {
            log.warn("Dropping task for unknown job {}", task);
            queue.complete(task, TaskState.FAILED_TERMINAL);
            return;
        }
        CrawlJob job = found.get();
        if (job.isTerminal() || job.isCancelRequested()) {
            queue.complete(task, TaskState.DONE);
            job.tasksDropped(1);
            coordinator.finishIfDone(job);
            return;
        }
        coordinator.start(job);
        boolean requeued = false;
        try {
            if (task.getKind() == FetchTaskKind.SITEMAP) {
                seedFromSitemap(job, task);
            } else {
                requeued = fetchAndHandle(job, task);
            }
        } catch (RuntimeException e) {
            log.warn("Task failed unexpectedly jobId={} url={}", job.getId(), task.getUrl(), e);
            failTask(job, task, CrawlErrorKind.TERMINAL_FETCH, FailureReasonClassifier.UNKNOWN, String.valueOf(e.getMessage()));
        } finally {
            if (!requeued) {
                coordinator.finishIfDone(job);
            }
        }
    }

    /**
     * @return true when the task went back to the queue
     */
    private boolean fetchAndHandle(CrawlJob job, FetchTask task) {
        int attempt = task.incrementAttempts();
        RenderResult render;
        try {
            render = pageFetcher.fetch(task.getUrl(), task.getConcurrencyClass());
        } catch (TransientFetchException e) {
            task.setLastReasonCode(e.getReasonCode());
            if (FailureReasonClassifier.INTERRUPTED.equals(e.getReasonCode()) || Thread.currentThread().isInterrupted()) {
                // shutdown in progress; the task stays pending so it can be saved for resume
                queue.retryLater(task, 0);
                return true;
            }
            if (retryPolicy.shouldRetry(e.getReasonCode(), attempt) && job.isAcceptingTasks()) {
                long delayMs = retryPolicy.backoffDelayMs(attempt);
                log.warn("Retrying fetch jobId={} url={} attempt={} reason={} delayMs={}",
                    job.getId(), task.getUrl(), attempt, e.getReasonCode(), delayMs);
                queue.retryLater(task, delayMs);
                return true;
            }
            failTask(job, task, CrawlErrorKind.TERMINAL_FETCH, e.getReasonCode(), e.getMessage());
            return false;
        } catch (CrawlException e) {
            task.setLastReasonCode(e.getReasonCode());
            failTask(job, task, e.getKind(), e.getReasonCode(), e.getMessage());
            return false;
        }

        ExtractionResult result = extractor.extract(render.html(), render.finalUrlOrRequested());
        List<NormalizedProduct> products = normalize(job, task, result);
        if (result.lowQuality() && (result.pageType() == PageType.PRODUCT || result.pageType() == PageType.LISTING)) {
            coordinator.recordNote(job, task.getUrl(), CrawlErrorKind.EXTRACTION_LOW_CONFIDENCE, "low_confidence",
                "strategy " + result.strategy() + " confidence " + String.format("%.2f", result.confidence()));
        }

        job.pageVisited();
        if (job.markContentSaved(result.contentHash())) {
            if (unchangedSinceLastCrawl(job, task.getUrl(), result.contentHash())) {
                job.pageUnchanged();
                log.debug("Page unchanged since last crawl jobId={} url={}", job.getId(), task.getUrl());
            } else {
                coordinator.persist(job, "page " + task.getUrl(), () -> store.savePage(job.getId(), task.getUrl(), result));
            }
        }
        List<NormalizedProduct> fresh = new ArrayList<>();
        for (NormalizedProduct product : products) {
            if (job.getProducts().register(product)) {
                fresh.add(product);
            }
        }
        if (!fresh.isEmpty()) {
            coordinator.persist(job, "products " + task.getUrl(), () -> store.saveProducts(job.getId(), fresh));
        }
        log.debug("Page done jobId={} url={} type={} products={} new={}",
            job.getId(), task.getUrl(), result.pageType(), products.size(), fresh.size());

        scheduleFollowUps(job, task, result, products);
        queue.complete(task, TaskState.DONE);
        job.taskResolved(false);
        return false;
    }

    private boolean unchangedSinceLastCrawl(CrawlJob job, String url, String contentHash) {
        if (contentHash == null) {
            return false;
        }
        try {
            return store.findLatestContentHash(url).map(contentHash::equals).orElse(false);
        } catch (PersistenceUnavailableException e) {
            log.warn("Could not read previous content hash jobId={} url={}, saving page", job.getId(), url, e);
            return false;
        }
    }

    /**
     * Reads the site's sitemaps and queues the pages they list. A missing or unreadable sitemap only leaves a
     * note in the ledger; the crawl goes on from the root page.
     */
    private void seedFromSitemap(CrawlJob job, FetchTask task) {
        task.incrementAttempts();
        SitemapDiscoveryResult discovery = sitemapService.discover(List.of(task.getUrl()), task.getConcurrencyClass(), job.getMaxPages());
        int queued = 0;
        for (SitemapUrlEntry entry : discovery.entries()) {
            if (!job.isAcceptingTasks()) {
                break;
            }
            if (coordinator.schedule(job, entry.url(), FetchTaskKind.SITEMAP_ENTRY, 0)) {
                queued++;
            }
        }
        if (discovery.entries().isEmpty()) {
            coordinator.recordNote(job, task.getUrl(), CrawlErrorKind.SITEMAP_UNAVAILABLE, "sitemap_unavailable",
                discovery.errors().isEmpty() ? "sitemap lists no pages" : "sitemap errors " + discovery.errors());
        }
        log.info("Sitemap seeded jobId={} sitemaps={} listed={} queued={}",
            job.getId(), discovery.fetchedSitemaps().size(), discovery.entries().size(), queued);
        queue.complete(task, TaskState.DONE);
        job.auxiliaryTaskResolved();
    }

    private void scheduleFollowUps(CrawlJob job, FetchTask task, ExtractionResult result, List<NormalizedProduct> products) {
        if (drivesTraversal(task)) {
            job.getTraversal().onPageCompleted(task.getUrl(), products, result.pagination())
                .ifPresent(next -> coordinator.schedule(job, next, FetchTaskKind.PAGINATION, 0));
        }
        if (result.pageType() == PageType.LISTING && job.isFollowProductLinks()) {
            for (String link : result.productLinks()) {
                coordinator.schedule(job, link, FetchTaskKind.PRODUCT_DETAIL, 0);
            }
        }
    }

    private static boolean drivesTraversal(FetchTask task) {
        return task.getKind() == FetchTaskKind.ROOT || task.getKind() == FetchTaskKind.PAGINATION;
    }

    private List<NormalizedProduct> normalize(CrawlJob job, FetchTask task, ExtractionResult result) {
        List<NormalizedProduct> out = new ArrayList<>(result.products().size());
        for (RawProduct raw : result.products()) {
            NormalizedProduct product = normalizer.normalize(raw);
            if (raw.rawPrice() != null && !raw.rawPrice().isBlank() && product.price().isAmbiguous()) {
                coordinator.recordNote(job, task.getUrl(), CrawlErrorKind.NORMALIZATION_AMBIGUOUS, "ambiguous_price",
                    "could not read price '" + raw.rawPrice() + "'");
            }
            out.add(product);
        }
        return out;
    }

    private void failTask(CrawlJob job, FetchTask task, CrawlErrorKind kind, String reasonCode, String message) {
        log.warn("Task failed jobId={} url={} attempts={} reason={}", job.getId(), task.getUrl(), task.getAttempts(), reasonCode);
        coordinator.recordFailure(job, task, kind, reasonCode, message);
        if (drivesTraversal(task)) {
            job.getTraversal().onPageFailed(task.getUrl());
        }
        queue.complete(task, TaskState.FAILED_TERMINAL);
        job.taskResolved(true);
    }
}
