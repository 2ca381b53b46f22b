package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.PendingTaskRecord;

import java.util.List;
import java.util.Optional;

/**
 * Storage used by the crawl pipeline. Implementations own the schema; callers only see these operations.
 * Any method may throw {@link com.delta.catalogcrawler.crawl.error.PersistenceUnavailableException} when the
 * backing store cannot be reached.
 */
public interface CrawlStore {

    void savePage(String jobId, String url, ExtractionResult result);

    /**
     * Content hash of the most recently stored crawl of {@code url}, from any job.
     */
    Optional<String> findLatestContentHash(String url);

    void saveProducts(String jobId, List<NormalizedProduct> products);

    Optional<PatternRecord> getPattern(String domain, PageType pageType);

    void savePattern(PatternRecord record);

    void saveJob(JobSnapshot snapshot);

    Optional<JobSnapshot> findJob(String jobId);

    void savePendingTasks(List<PendingTaskRecord> tasks);

    List<PendingTaskRecord> loadPendingTasks();

    void clearPendingTasks(String jobId);
}
