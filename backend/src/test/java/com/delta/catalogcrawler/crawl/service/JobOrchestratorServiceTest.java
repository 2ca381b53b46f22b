package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.error.JobNotFoundException;
import com.delta.catalogcrawler.crawl.error.ResourceExhaustionException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.CrawlRequest;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.JobStatus;
import com.delta.catalogcrawler.crawl.model.JobStatusResponse;
import com.delta.catalogcrawler.crawl.persistence.AsyncStoreWriter;
import com.delta.catalogcrawler.crawl.persistence.CrawlStore;
import com.delta.catalogcrawler.crawl.queue.JobCoordinator;
import com.delta.catalogcrawler.crawl.queue.QueueWorkerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobOrchestratorServiceTest {
    private CrawlerProperties properties;
    private JobRegistry registry;
    private QueueWorkerService queueWorkerService;
    private JobCoordinator coordinator;
    private AsyncStoreWriter writer;
    private CrawlStore store;
    private JobOrchestratorService service;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.setTrustedDomains(List.of("partner.example.com"));
        registry = new JobRegistry();
        queueWorkerService = Mockito.mock(QueueWorkerService.class);
        coordinator = Mockito.mock(JobCoordinator.class);
        writer = Mockito.mock(AsyncStoreWriter.class);
        store = Mockito.mock(CrawlStore.class);
        service = new JobOrchestratorService(
            new DomainPolicyService(properties), registry, queueWorkerService, coordinator, writer, store, properties
        );
    }

    @Test
    void enqueueAppliesDefaults() {
        String jobId = service.enqueueCrawl(new CrawlRequest(
            "https://www.shop.example.com/catalog/", null, null, null, null, null, null, null, null
        ));

        CrawlJob job = submitted();
        assertThat(job.getId()).isEqualTo(jobId);
        assertThat(job.getRootUrl()).isEqualTo("https://www.shop.example.com/catalog");
        assertThat(job.getDomain()).isEqualTo("shop.example.com");
        assertThat(job.getConcurrencyClass()).isEqualTo(ConcurrencyClass.STANDARD);
        assertThat(job.getMaxPages()).isEqualTo(properties.getJob().getDefaultMaxPages());
        assertThat(job.getPriority()).isEqualTo(properties.getJob().getDefaultPriority());
        assertThat(job.isFollowPagination()).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(Duration.between(job.getCreatedAt(), job.getDeadline()).getSeconds())
            .isEqualTo(properties.getJob().getDefaultTimeoutSeconds());
    }

    @Test
    void maxPagesIsCapped() {
        service.enqueueCrawl(new CrawlRequest(
            "https://partner.example.com/", null, 1_000_000, ConcurrencyClass.TRUSTED, false, false, 9, 30, null
        ));

        CrawlJob job = submitted();
        assertThat(job.getMaxPages()).isEqualTo(properties.getJob().getMaxPagesCap());
        assertThat(job.getConcurrencyClass()).isEqualTo(ConcurrencyClass.TRUSTED);
        assertThat(job.getPriority()).isEqualTo(9);
        assertThat(job.isFollowProductLinks()).isFalse();
    }

    @Test
    void outOfRangeLimitsAreRejected() {
        assertReason(new CrawlRequest("https://shop.example.com/", null, 0, null, null, null, null, null, null), "invalid_max_pages");
        assertReason(new CrawlRequest("https://shop.example.com/", null, 10, null, null, null, 11, null, null), "invalid_priority");
        assertReason(new CrawlRequest("https://shop.example.com/", null, 10, null, null, null, null, 0, null), "invalid_timeout");
        assertReason(new CrawlRequest("mailto:someone@example.com", null, 10, null, null, null, null, null, null), "invalid_url");

        verify(queueWorkerService, never()).submitJob(any(), anyBoolean());
    }

    @Test
    void sitemapSeedingFollowsTheRequestOverTheConfiguredDefault() {
        properties.getSitemap().setEnabledByDefault(true);

        service.enqueueCrawl(CrawlRequest.of("https://shop.example.com/", 5, true));
        service.enqueueCrawl(new CrawlRequest("https://outlet.example.com/", null, 5, null, null, null, null, null, false));

        verify(queueWorkerService).submitJob(Mockito.argThat(job -> job.getDomain().equals("shop.example.com")), eq(true));
        verify(queueWorkerService).submitJob(Mockito.argThat(job -> job.getDomain().equals("outlet.example.com")), eq(false));
    }

    @Test
    void saturatedStorageRejectsNewJobs() {
        when(writer.isSaturated()).thenReturn(true);
        when(writer.awaitCapacity(anyLong())).thenReturn(false);

        assertThatThrownBy(() -> service.enqueueCrawl(CrawlRequest.of("https://shop.example.com/", 5, true)))
            .isInstanceOf(ResourceExhaustionException.class);
        verify(queueWorkerService, never()).submitJob(any(), anyBoolean());
    }

    @Test
    void statusFallsBackToStoredSnapshot() {
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        when(store.findJob("old-job")).thenReturn(Optional.of(new JobSnapshot(
            "old-job", "https://shop.example.com/", "shop.example.com", ConcurrencyClass.STANDARD, 10, true, true, 5, 60,
            JobStatus.COMPLETED, 7, 12, 1, created, created.plusSeconds(30)
        )));

        JobStatusResponse status = service.getJobStatus("old-job");

        assertThat(status.state()).isEqualTo(JobStatus.COMPLETED);
        assertThat(status.pagesVisited()).isEqualTo(7);
        assertThat(status.productsFound()).isEqualTo(12);
        assertThat(status.errors()).isEmpty();
    }

    @Test
    void unknownJobIsNotFound() {
        when(store.findJob("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getJobStatus("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.cancelJob("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void cancelDelegatesForLiveJobs() {
        Instant now = Instant.now();
        CrawlJob job = new CrawlJob(
            "live", "https://shop.example.com/", "shop.example.com", ConcurrencyClass.STANDARD,
            10, true, true, 5, 60, 3, now, now.plusSeconds(60)
        );
        registry.register(job);

        JobStatusResponse status = service.cancelJob("live");

        verify(coordinator).cancel(job);
        assertThat(status.jobId()).isEqualTo("live");
        assertThat(service.getJobStatus("live").jobId()).isEqualTo("live");
    }

    @Test
    void cancelOfFinishedJobIsNoop() {
        Instant now = Instant.now();
        CrawlJob job = new CrawlJob(
            "done", "https://shop.example.com/", "shop.example.com", ConcurrencyClass.STANDARD,
            10, true, true, 5, 60, 3, now, now.plusSeconds(60)
        );
        job.finish(JobStatus.COMPLETED, now);
        registry.register(job);

        assertThat(service.cancelJob("done").state()).isEqualTo(JobStatus.COMPLETED);
        verify(coordinator, never()).cancel(any());
    }

    private CrawlJob submitted() {
        ArgumentCaptor<CrawlJob> captor = ArgumentCaptor.forClass(CrawlJob.class);
        verify(queueWorkerService).submitJob(captor.capture(), anyBoolean());
        return captor.getValue();
    }

    private void assertReason(CrawlRequest request, String reasonCode) {
        assertThatThrownBy(() -> service.enqueueCrawl(request))
            .isInstanceOf(InvalidRequestException.class)
            .satisfies(e -> assertThat(((InvalidRequestException) e).getReasonCode()).isEqualTo(reasonCode));
    }
}
