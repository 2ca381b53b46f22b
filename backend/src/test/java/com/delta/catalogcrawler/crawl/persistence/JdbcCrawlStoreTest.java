package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.error.PersistenceUnavailableException;
import com.delta.catalogcrawler.crawl.model.Availability;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.JobStatus;
import com.delta.catalogcrawler.crawl.model.NormalizedPrice;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PaginationHint;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.PendingTaskRecord;
import com.delta.catalogcrawler.crawl.model.Platform;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class JdbcCrawlStoreTest {

    @Autowired
    private JdbcCrawlStore store;

    @Test
    void jobSnapshotUpsertKeepsLatestProgress() {
        String jobId = UUID.randomUUID().toString();
        Instant created = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        store.saveJob(snapshot(jobId, JobStatus.RUNNING, 1, null, created));
        store.saveJob(snapshot(jobId, JobStatus.PARTIAL, 4, created.plusSeconds(12), created));

        JobSnapshot loaded = store.findJob(jobId).orElseThrow();
        assertThat(loaded.status()).isEqualTo(JobStatus.PARTIAL);
        assertThat(loaded.pagesVisited()).isEqualTo(4);
        assertThat(loaded.concurrencyClass()).isEqualTo(ConcurrencyClass.STANDARD);
        assertThat(loaded.createdAt()).isEqualTo(created);
        assertThat(loaded.finishedAt()).isEqualTo(created.plusSeconds(12));
        assertThat(store.findJob("no-such-job")).isEmpty();
    }

    @Test
    void invalidatedPatternsAreNotReturned() {
        String domain = "patterns-" + UUID.randomUUID() + ".example.com";
        Instant now = Instant.now();

        store.savePattern(new PatternRecord(domain, PageType.PRODUCT, ExtractionStrategy.MICRODATA, 0.625, 0, 2, 0, 2, now, false));
        Optional<PatternRecord> loaded = store.getPattern(domain, PageType.PRODUCT);
        assertThat(loaded).isPresent();
        assertThat(loaded.get().strategy()).isEqualTo(ExtractionStrategy.MICRODATA);
        assertThat(loaded.get().confidence()).isEqualTo(0.625);
        assertThat(store.getPattern(domain, PageType.LISTING)).isEmpty();

        store.savePattern(new PatternRecord(domain, PageType.PRODUCT, ExtractionStrategy.MICRODATA, 0.078125, 3, 2, 3, 5, now, true));
        assertThat(store.getPattern(domain, PageType.PRODUCT)).isEmpty();
    }

    @Test
    void schemaRejectsConfidenceOutsideTheUnitRange() {
        String domain = "range-" + UUID.randomUUID() + ".example.com";
        Instant now = Instant.now();

        assertThatThrownBy(() -> store.savePattern(
            new PatternRecord(domain, PageType.PRODUCT, ExtractionStrategy.JSON_LD, 1.5, 0, 1, 0, 1, now, false)
        )).isInstanceOf(PersistenceUnavailableException.class);
        assertThat(store.getPattern(domain, PageType.PRODUCT)).isEmpty();
    }

    @Test
    void pagesAndProductsAreStoredPerJob() {
        String jobId = UUID.randomUUID().toString();
        ExtractionResult page = new ExtractionResult(
            "https://shop.example.com/p/1",
            PageType.PRODUCT,
            Platform.SHOPIFY,
            "Anvil",
            "A heavy anvil",
            List.of(),
            LocalDate.of(2024, 3, 5),
            "hash-1",
            ExtractionStrategy.JSON_LD,
            0.9,
            false,
            List.of(),
            PaginationHint.none(),
            List.of(),
            null,
            List.of()
        );
        NormalizedProduct product = new NormalizedProduct(
            "Anvil",
            new NormalizedPrice(new BigDecimal("129.00"), "USD", false, null),
            Availability.IN_STOCK,
            "ANV-1",
            List.of(),
            Map.of("weight", "50 kg"),
            "https://shop.example.com/p/1",
            List.of("https://cdn.example.com/anvil.jpg"),
            "Acme"
        );

        store.savePage(jobId, "https://shop.example.com/p/1", page);
        store.saveProducts(jobId, List.of(product, product));
        store.saveProducts(jobId, List.of());

        assertThat(store.countPages(jobId)).isEqualTo(1);
        assertThat(store.countProducts(jobId)).isEqualTo(2);
        assertThat(store.countProducts("other-job")).isZero();
    }

    @Test
    void latestContentHashComesFromTheNewestCrawlOfTheUrl() {
        String url = "https://shop.example.com/c/" + UUID.randomUUID();

        assertThat(store.findLatestContentHash(url)).isEmpty();
        store.savePage(UUID.randomUUID().toString(), url, listingPage(url, "hash-old"));
        store.savePage(UUID.randomUUID().toString(), url, listingPage(url, "hash-new"));
        store.savePage(UUID.randomUUID().toString(), url + "/other", listingPage(url + "/other", "hash-elsewhere"));

        assertThat(store.findLatestContentHash(url)).contains("hash-new");
    }

    @Test
    void pendingTasksRoundTripInSavedOrder() {
        String jobId = UUID.randomUUID().toString();
        store.savePendingTasks(List.of(
            new PendingTaskRecord(jobId, "https://shop.example.com/", FetchTaskKind.ROOT, 5, 0),
            new PendingTaskRecord(jobId, "https://shop.example.com/page/2", FetchTaskKind.PAGINATION, 5, 1)
        ));

        List<PendingTaskRecord> mine = store.loadPendingTasks().stream()
            .filter(task -> task.jobId().equals(jobId))
            .toList();
        assertThat(mine).extracting(PendingTaskRecord::kind)
            .containsExactly(FetchTaskKind.ROOT, FetchTaskKind.PAGINATION);
        assertThat(mine.get(1).attempts()).isEqualTo(1);

        store.clearPendingTasks(jobId);
        assertThat(store.loadPendingTasks()).noneMatch(task -> task.jobId().equals(jobId));
    }

    private static ExtractionResult listingPage(String url, String contentHash) {
        return new ExtractionResult(
            url, PageType.LISTING, Platform.GENERIC_ECOMMERCE, "Catalog", "Catalog page", List.of(), null, contentHash,
            ExtractionStrategy.DOM_HEURISTICS, 0.6, false, List.of(), PaginationHint.none(), List.of(), null, List.of()
        );
    }

    private static JobSnapshot snapshot(String jobId, JobStatus status, int pages, Instant finishedAt, Instant created) {
        return new JobSnapshot(
            jobId, "https://shop.example.com/", "shop.example.com", ConcurrencyClass.STANDARD, 10, true, true, 5, 60,
            status, pages, 2, 1, created, finishedAt
        );
    }
}
