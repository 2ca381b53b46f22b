package com.delta.catalogcrawler.crawl.pattern;

import com.delta.catalogcrawler.crawl.model.PatternKey;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.persistence.AsyncStoreWriter;
import com.delta.catalogcrawler.crawl.persistence.CrawlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;

/**
 * Learned patterns shared by every job, keyed by (domain, page type).
 * <p>
 * Reads never block: a miss schedules a background load from the store and answers empty.
 * Updates are optimistic read-modify-write loops over {@link ConcurrentHashMap#replace(Object, Object, Object)},
 * each accepted update bumping the record version. Invalidated records are persisted and dropped from memory.
 */
@Component
public class PatternCache {
    private static final Logger log = LoggerFactory.getLogger(PatternCache.class);

    private final Map<PatternKey, PatternRecord> records = new ConcurrentHashMap<>();
    private final Set<PatternKey> loadAttempted = ConcurrentHashMap.newKeySet();
    private final CrawlStore store;
    private final AsyncStoreWriter writer;
    private final ExecutorService loadExecutor;

    public PatternCache(
        CrawlStore store,
        AsyncStoreWriter writer,
        @Qualifier("patternLoadExecutor") ExecutorService loadExecutor
    ) {
        this.store = store;
        this.writer = writer;
        this.loadExecutor = loadExecutor;
    }

    public Optional<PatternRecord> get(PatternKey key) {
        PatternRecord record = records.get(key);
        if (record == null) {
            scheduleLoad(key);
        }
        return Optional.ofNullable(record);
    }

    /**
     * Applies {@code updater} to the current record (null when absent) until the write lands without a
     * concurrent modification in between. Returning null from the updater leaves the cache unchanged.
     *
     * @return the stored record, or null when nothing was stored
     */
    public PatternRecord update(PatternKey key, UnaryOperator<PatternRecord> updater) {
        while (true) {
            PatternRecord current = records.get(key);
            PatternRecord proposed = updater.apply(current);
            if (proposed == null || proposed == current) {
                return current;
            }
            PatternRecord next = withVersion(proposed, current == null ? 1 : current.version() + 1);
            boolean applied;
            if (next.invalidated()) {
                applied = current == null || records.remove(key, current);
            } else if (current == null) {
                applied = records.putIfAbsent(key, next) == null;
            } else {
                applied = records.replace(key, current, next);
            }
            if (applied) {
                loadAttempted.add(key);
                persist(next);
                return next;
            }
        }
    }

    public void invalidate(PatternKey key) {
        records.remove(key);
    }

    public int size() {
        return records.size();
    }

    private void scheduleLoad(PatternKey key) {
        if (!loadAttempted.add(key)) {
            return;
        }
        try {
            loadExecutor.execute(() -> load(key));
        } catch (RejectedExecutionException e) {
            loadAttempted.remove(key);
            log.debug("Pattern load rejected domain={} pageType={}", key.domain(), key.pageType());
        }
    }

    private void load(PatternKey key) {
        try {
            store.getPattern(key.domain(), key.pageType())
                .filter(record -> !record.invalidated())
                .ifPresent(record -> records.putIfAbsent(key, record));
        } catch (RuntimeException e) {
            loadAttempted.remove(key);
            log.warn("Pattern load failed domain={} pageType={}", key.domain(), key.pageType(), e);
        }
    }

    private void persist(PatternRecord record) {
        writer.write("pattern " + record.domain() + "/" + record.pageType().key(), () -> store.savePattern(record));
    }

    private static PatternRecord withVersion(PatternRecord record, long version) {
        return new PatternRecord(
            record.domain(),
            record.pageType(),
            record.strategy(),
            record.confidence(),
            record.consecutiveFailures(),
            record.successCount(),
            record.failureCount(),
            version,
            record.lastValidatedAt(),
            record.invalidated()
        );
    }
}
