package com.delta.catalogcrawler.crawl.api;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.model.CatalogCrawlOptions;
import com.delta.catalogcrawler.crawl.model.CatalogCrawlResult;
import com.delta.catalogcrawler.crawl.model.CrawlRequest;
import com.delta.catalogcrawler.crawl.model.JobStatusResponse;
import com.delta.catalogcrawler.crawl.pagination.PaginationCrawler;
import com.delta.catalogcrawler.crawl.service.JobOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final JobOrchestratorService orchestratorService;
    private final PaginationCrawler paginationCrawler;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(
        JobOrchestratorService orchestratorService,
        PaginationCrawler paginationCrawler,
        CrawlerProperties crawlerProperties
    ) {
        this.orchestratorService = orchestratorService;
        this.paginationCrawler = paginationCrawler;
        this.crawlerProperties = crawlerProperties;
    }

    @PostMapping("/crawl-jobs")
    public ResponseEntity<Map<String, String>> enqueue(@RequestBody(required = false) CrawlRequest request) {
        String jobId = orchestratorService.enqueueCrawl(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }

    @GetMapping("/crawl-jobs/{jobId}")
    public JobStatusResponse status(@PathVariable("jobId") String jobId) {
        return orchestratorService.getJobStatus(jobId);
    }

    @PostMapping("/crawl-jobs/{jobId}/cancel")
    public JobStatusResponse cancel(@PathVariable("jobId") String jobId) {
        return orchestratorService.cancelJob(jobId);
    }

    /**
     * Synchronous catalog walk; the caller waits for every page.
     */
    @PostMapping("/catalog/crawl")
    public CatalogCrawlResult crawlCatalog(@RequestBody(required = false) CatalogCrawlApiRequest request) {
        if (request == null) {
            throw new InvalidRequestException("missing_request", "request body is required");
        }
        int maxPages = request.maxPages() == null
            ? crawlerProperties.getJob().getDefaultMaxPages()
            : Math.min(request.maxPages(), crawlerProperties.getJob().getMaxPagesCap());
        if (maxPages < 1) {
            throw new InvalidRequestException("invalid_max_pages", "maxPages must be at least 1");
        }
        boolean followPagination = request.followPagination() == null || request.followPagination();
        return paginationCrawler.crawlCatalog(request.startUrl(), new CatalogCrawlOptions(maxPages, followPagination));
    }
}
