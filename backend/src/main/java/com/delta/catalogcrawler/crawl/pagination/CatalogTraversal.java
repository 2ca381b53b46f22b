package com.delta.catalogcrawler.crawl.pagination;

import com.delta.catalogcrawler.crawl.model.CatalogStopReason;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.PaginationHint;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Page-after-page state of one catalog traversal: visited pages, collected products and the stall counter.
 * The caller reports each completed page and receives the next page to fetch, if any; at most one page
 * is outstanding at a time.
 */
public class CatalogTraversal {
    private final int maxPages;
    private final boolean followPagination;
    private final int stallPageLimit;
    private final String domain;
    private final ProductDeduplicator deduplicator = new ProductDeduplicator();
    private final Set<String> visited = new HashSet<>();
    private final List<NormalizedProduct> products = new ArrayList<>();

    private int pagesVisited;
    private int consecutiveStalledPages;
    private CatalogStopReason stopReason;

    /**
     * @param domain next-page links outside this domain end the traversal; null accepts any host
     */
    public CatalogTraversal(int maxPages, boolean followPagination, int stallPageLimit, String domain) {
        this.maxPages = Math.max(1, maxPages);
        this.followPagination = followPagination;
        this.stallPageLimit = Math.max(1, stallPageLimit);
        this.domain = domain;
    }

    public CatalogTraversal(int maxPages, boolean followPagination, int stallPageLimit) {
        this(maxPages, followPagination, stallPageLimit, null);
    }

    /**
     * Records a fetched page and decides what comes next.
     *
     * @return the next page URL, or empty once the traversal has stopped
     */
    public synchronized Optional<String> onPageCompleted(String url, List<NormalizedProduct> pageProducts, PaginationHint hint) {
        markVisited(url);
        pagesVisited++;
        int newProducts = 0;
        for (NormalizedProduct product : pageProducts) {
            if (deduplicator.register(product)) {
                products.add(product);
                newProducts++;
            }
        }
        consecutiveStalledPages = newProducts == 0 ? consecutiveStalledPages + 1 : 0;

        if (stopReason != null) {
            return Optional.empty();
        }
        if (consecutiveStalledPages >= stallPageLimit) {
            return stop(CatalogStopReason.STALLED);
        }
        if (!followPagination || hint == null || !hint.hasNext()) {
            return stop(CatalogStopReason.NO_FURTHER_PAGINATION);
        }
        if (pagesVisited >= maxPages) {
            return stop(CatalogStopReason.MAX_PAGES_REACHED);
        }
        String next = UrlNormalizer.normalize(hint.nextUrl());
        if (next == null || visited.contains(next)) {
            return stop(CatalogStopReason.NO_FURTHER_PAGINATION);
        }
        if (domain != null && !UrlNormalizer.isWithinDomain(UrlNormalizer.hostOf(next), domain)) {
            return stop(CatalogStopReason.NO_FURTHER_PAGINATION);
        }
        return Optional.of(next);
    }

    /**
     * A page could not be fetched. Failing on the start page fails the traversal; a broken link further on
     * ends it as having no further pagination.
     */
    public synchronized void onPageFailed(String url) {
        markVisited(url);
        if (stopReason == null) {
            stopReason = pagesVisited == 0 ? CatalogStopReason.FETCH_FAILED : CatalogStopReason.NO_FURTHER_PAGINATION;
        }
    }

    public synchronized void cancel() {
        if (stopReason == null) {
            stopReason = CatalogStopReason.CANCELLED;
        }
    }

    public synchronized boolean isStopped() {
        return stopReason != null;
    }

    public synchronized boolean hasVisited(String url) {
        String normalized = UrlNormalizer.normalize(url);
        return normalized != null && visited.contains(normalized);
    }

    public synchronized int pagesVisited() {
        return pagesVisited;
    }

    public synchronized List<NormalizedProduct> products() {
        return List.copyOf(products);
    }

    public synchronized CatalogStopReason stopReason() {
        return stopReason;
    }

    private void markVisited(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized != null) {
            visited.add(normalized);
        }
    }

    private Optional<String> stop(CatalogStopReason reason) {
        stopReason = reason;
        return Optional.empty();
    }
}
