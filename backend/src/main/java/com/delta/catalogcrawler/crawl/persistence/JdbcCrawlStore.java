package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.error.PersistenceUnavailableException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.JobSnapshot;
import com.delta.catalogcrawler.crawl.model.JobStatus;
import com.delta.catalogcrawler.crawl.model.NormalizedPrice;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.PendingTaskRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational {@link CrawlStore}. Upserts use {@code ON CONFLICT} on PostgreSQL and {@code MERGE} elsewhere (H2 in tests).
 */
@Repository
public class JdbcCrawlStore implements CrawlStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCrawlStore.class);
    private static final int MAX_TEXT_CHARS = 200_000;
    private static final int MAX_TITLE_CHARS = 1024;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public JdbcCrawlStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public void savePage(String jobId, String url, ExtractionResult result) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("url", url)
            .addValue("finalUrl", result.url())
            .addValue("pageType", result.pageType().name())
            .addValue("platform", result.platform() == null ? null : result.platform().name())
            .addValue("title", truncate(result.title(), MAX_TITLE_CHARS))
            .addValue("cleanedText", truncate(result.cleanedText(), MAX_TEXT_CHARS))
            .addValue("publishedDate", result.publishedDate() == null ? null : Date.valueOf(result.publishedDate()))
            .addValue("contentHash", result.contentHash())
            .addValue("strategy", result.strategy() == null ? null : result.strategy().name())
            .addValue("confidence", result.confidence())
            .addValue("lowQuality", result.lowQuality())
            .addValue("productCount", result.products().size())
            .addValue("nextUrl", result.pagination().nextUrl())
            .addValue("fetchedAt", toTimestamp(Instant.now()));
        guarded("save page", () -> jdbc.update(
            """
                INSERT INTO crawl_pages (
                    job_id,
                    url,
                    final_url,
                    page_type,
                    platform,
                    title,
                    cleaned_text,
                    published_date,
                    content_hash,
                    strategy,
                    confidence,
                    low_quality,
                    product_count,
                    next_url,
                    fetched_at
                )
                VALUES (
                    :jobId,
                    :url,
                    :finalUrl,
                    :pageType,
                    :platform,
                    :title,
                    :cleanedText,
                    :publishedDate,
                    :contentHash,
                    :strategy,
                    :confidence,
                    :lowQuality,
                    :productCount,
                    :nextUrl,
                    :fetchedAt
                )
                """,
            params
        ));
    }

    @Override
    public void saveProducts(String jobId, List<NormalizedProduct> products) {
        if (products == null || products.isEmpty()) {
            return;
        }
        Timestamp now = toTimestamp(Instant.now());
        MapSqlParameterSource[] batch = new MapSqlParameterSource[products.size()];
        for (int i = 0; i < products.size(); i++) {
            NormalizedProduct product = products.get(i);
            NormalizedPrice price = product.price() == null ? NormalizedPrice.unknown() : product.price();
            batch[i] = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("url", product.url())
                .addValue("sku", product.sku())
                .addValue("name", truncate(product.name(), MAX_TITLE_CHARS))
                .addValue("priceAmount", price.amount())
                .addValue("currency", price.currency())
                .addValue("quoteOnly", price.quoteOnly())
                .addValue("vatIncluded", price.vatIncluded())
                .addValue("availability", product.availability() == null ? null : product.availability().wireValue())
                .addValue("brand", product.brand())
                .addValue("payload", toJson(product))
                .addValue("createdAt", now);
        }
        guarded("save products", () -> jdbc.batchUpdate(
            """
                INSERT INTO crawl_products (
                    job_id,
                    url,
                    sku,
                    name,
                    price_amount,
                    currency,
                    quote_only,
                    vat_included,
                    availability,
                    brand,
                    payload,
                    created_at
                )
                VALUES (
                    :jobId,
                    :url,
                    :sku,
                    :name,
                    :priceAmount,
                    :currency,
                    :quoteOnly,
                    :vatIncluded,
                    :availability,
                    :brand,
                    :payload,
                    :createdAt
                )
                """,
            batch
        ));
    }

    @Override
    public Optional<String> findLatestContentHash(String url) {
        List<String> rows = guarded("load content hash", () -> jdbc.queryForList(
            """
                SELECT content_hash
                FROM crawl_pages
                WHERE url = :url
                  AND content_hash IS NOT NULL
                ORDER BY fetched_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("url", url),
            String.class
        ));
        return rows.stream().findFirst();
    }

    @Override
    public Optional<PatternRecord> getPattern(String domain, PageType pageType) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("pageType", pageType.name());
        List<PatternRecord> rows = guarded("load pattern", () -> jdbc.query(
            """
                SELECT domain, page_type, strategy, confidence, consecutive_failures, success_count,
                       failure_count, version, last_validated_at, invalidated
                FROM extraction_patterns
                WHERE domain = :domain
                  AND page_type = :pageType
                  AND invalidated = FALSE
                """,
            params,
            (rs, rowNum) -> new PatternRecord(
                rs.getString("domain"),
                PageType.valueOf(rs.getString("page_type")),
                ExtractionStrategy.valueOf(rs.getString("strategy")),
                rs.getDouble("confidence"),
                rs.getInt("consecutive_failures"),
                rs.getLong("success_count"),
                rs.getLong("failure_count"),
                rs.getLong("version"),
                toInstant(rs.getTimestamp("last_validated_at")),
                rs.getBoolean("invalidated")
            )
        ));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void savePattern(PatternRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", record.domain())
            .addValue("pageType", record.pageType().name())
            .addValue("strategy", record.strategy().name())
            .addValue("confidence", record.confidence())
            .addValue("consecutiveFailures", record.consecutiveFailures())
            .addValue("successCount", record.successCount())
            .addValue("failureCount", record.failureCount())
            .addValue("version", record.version())
            .addValue("lastValidatedAt", toTimestamp(record.lastValidatedAt()))
            .addValue("invalidated", record.invalidated());
        if (postgres) {
            guarded("save pattern", () -> jdbc.update(
                """
                    INSERT INTO extraction_patterns (
                        domain, page_type, strategy, confidence, consecutive_failures, success_count,
                        failure_count, version, last_validated_at, invalidated
                    )
                    VALUES (
                        :domain, :pageType, :strategy, :confidence, :consecutiveFailures, :successCount,
                        :failureCount, :version, :lastValidatedAt, :invalidated
                    )
                    ON CONFLICT (domain, page_type)
                    DO UPDATE SET
                        strategy = EXCLUDED.strategy,
                        confidence = EXCLUDED.confidence,
                        consecutive_failures = EXCLUDED.consecutive_failures,
                        success_count = EXCLUDED.success_count,
                        failure_count = EXCLUDED.failure_count,
                        version = EXCLUDED.version,
                        last_validated_at = EXCLUDED.last_validated_at,
                        invalidated = EXCLUDED.invalidated
                    WHERE extraction_patterns.version <= EXCLUDED.version
                    """,
                params
            ));
            return;
        }
        guarded("save pattern", () -> jdbc.update(
            """
                MERGE INTO extraction_patterns (
                    domain, page_type, strategy, confidence, consecutive_failures, success_count,
                    failure_count, version, last_validated_at, invalidated
                )
                KEY(domain, page_type)
                VALUES (
                    :domain, :pageType, :strategy, :confidence, :consecutiveFailures, :successCount,
                    :failureCount, :version, :lastValidatedAt, :invalidated
                )
                """,
            params
        ));
    }

    @Override
    public void saveJob(JobSnapshot snapshot) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", snapshot.jobId())
            .addValue("rootUrl", snapshot.rootUrl())
            .addValue("domain", snapshot.domain())
            .addValue("concurrencyClass", snapshot.concurrencyClass().name())
            .addValue("maxPages", snapshot.maxPages())
            .addValue("followPagination", snapshot.followPagination())
            .addValue("followProductLinks", snapshot.followProductLinks())
            .addValue("priority", snapshot.priority())
            .addValue("timeoutSeconds", snapshot.timeoutSeconds())
            .addValue("status", snapshot.status().name())
            .addValue("pagesVisited", snapshot.pagesVisited())
            .addValue("productsFound", snapshot.productsFound())
            .addValue("errorCount", snapshot.errorCount())
            .addValue("createdAt", toTimestamp(snapshot.createdAt()))
            .addValue("finishedAt", toTimestamp(snapshot.finishedAt()))
            .addValue("updatedAt", toTimestamp(Instant.now()));
        if (postgres) {
            guarded("save job", () -> jdbc.update(
                """
                    INSERT INTO crawl_jobs (
                        job_id, root_url, domain, concurrency_class, max_pages, follow_pagination,
                        follow_product_links, priority, timeout_seconds, status, pages_visited, products_found,
                        error_count, created_at, finished_at, updated_at
                    )
                    VALUES (
                        :jobId, :rootUrl, :domain, :concurrencyClass, :maxPages, :followPagination,
                        :followProductLinks, :priority, :timeoutSeconds, :status, :pagesVisited, :productsFound,
                        :errorCount, :createdAt, :finishedAt, :updatedAt
                    )
                    ON CONFLICT (job_id)
                    DO UPDATE SET
                        status = EXCLUDED.status,
                        pages_visited = EXCLUDED.pages_visited,
                        products_found = EXCLUDED.products_found,
                        error_count = EXCLUDED.error_count,
                        finished_at = EXCLUDED.finished_at,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            ));
            return;
        }
        guarded("save job", () -> jdbc.update(
            """
                MERGE INTO crawl_jobs (
                    job_id, root_url, domain, concurrency_class, max_pages, follow_pagination,
                    follow_product_links, priority, timeout_seconds, status, pages_visited, products_found,
                    error_count, created_at, finished_at, updated_at
                )
                KEY(job_id)
                VALUES (
                    :jobId, :rootUrl, :domain, :concurrencyClass, :maxPages, :followPagination,
                    :followProductLinks, :priority, :timeoutSeconds, :status, :pagesVisited, :productsFound,
                    :errorCount, :createdAt, :finishedAt, :updatedAt
                )
                """,
            params
        ));
    }

    @Override
    public Optional<JobSnapshot> findJob(String jobId) {
        List<JobSnapshot> rows = guarded("load job", () -> jdbc.query(
            """
                SELECT job_id, root_url, domain, concurrency_class, max_pages, follow_pagination,
                       follow_product_links, priority, timeout_seconds, status, pages_visited, products_found,
                       error_count, created_at, finished_at
                FROM crawl_jobs
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new JobSnapshot(
                rs.getString("job_id"),
                rs.getString("root_url"),
                rs.getString("domain"),
                ConcurrencyClass.valueOf(rs.getString("concurrency_class")),
                rs.getInt("max_pages"),
                rs.getBoolean("follow_pagination"),
                rs.getBoolean("follow_product_links"),
                rs.getInt("priority"),
                rs.getInt("timeout_seconds"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getInt("pages_visited"),
                rs.getInt("products_found"),
                rs.getInt("error_count"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("finished_at"))
            )
        ));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void savePendingTasks(List<PendingTaskRecord> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return;
        }
        Timestamp now = toTimestamp(Instant.now());
        MapSqlParameterSource[] batch = new MapSqlParameterSource[tasks.size()];
        for (int i = 0; i < tasks.size(); i++) {
            PendingTaskRecord task = tasks.get(i);
            batch[i] = new MapSqlParameterSource()
                .addValue("jobId", task.jobId())
                .addValue("url", task.url())
                .addValue("kind", task.kind().name())
                .addValue("priority", task.priority())
                .addValue("attempts", task.attempts())
                .addValue("savedAt", now);
        }
        guarded("save pending tasks", () -> jdbc.batchUpdate(
            """
                INSERT INTO pending_fetch_tasks (job_id, url, kind, priority, attempts, saved_at)
                VALUES (:jobId, :url, :kind, :priority, :attempts, :savedAt)
                """,
            batch
        ));
        log.info("Saved pending fetch tasks count={}", tasks.size());
    }

    @Override
    public List<PendingTaskRecord> loadPendingTasks() {
        return guarded("load pending tasks", () -> jdbc.query(
            """
                SELECT job_id, url, kind, priority, attempts
                FROM pending_fetch_tasks
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new PendingTaskRecord(
                rs.getString("job_id"),
                rs.getString("url"),
                FetchTaskKind.valueOf(rs.getString("kind")),
                rs.getInt("priority"),
                rs.getInt("attempts")
            )
        ));
    }

    @Override
    public void clearPendingTasks(String jobId) {
        guarded("clear pending tasks", () -> jdbc.update(
            "DELETE FROM pending_fetch_tasks WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId)
        ));
    }

    public int countProducts(String jobId) {
        Integer count = guarded("count products", () -> jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_products WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            Integer.class
        ));
        return count == null ? 0 : count;
    }

    public int countPages(String jobId) {
        Integer count = guarded("count pages", () -> jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_pages WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            Integer.class
        ));
        return count == null ? 0 : count;
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException(operation + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private String toJson(NormalizedProduct product) {
        try {
            return objectMapper.writeValueAsString(product);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize product url={}", product.url(), e);
            return null;
        }
    }

    private static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
