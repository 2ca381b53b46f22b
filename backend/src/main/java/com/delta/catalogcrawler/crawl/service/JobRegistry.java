package com.delta.catalogcrawler.crawl.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of jobs known to this process. Finished jobs are kept for status queries until the
 * retention limit is reached, oldest finished first out.
 */
@Component
public class JobRegistry {
    private static final int MAX_FINISHED_JOBS = 10_000;

    private final Map<String, CrawlJob> jobs = new ConcurrentHashMap<>();

    public void register(CrawlJob job) {
        jobs.put(job.getId(), job);
        evictFinished();
    }

    public Optional<CrawlJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<CrawlJob> active() {
        List<CrawlJob> out = new ArrayList<>();
        for (CrawlJob job : jobs.values()) {
            if (!job.isTerminal()) {
                out.add(job);
            }
        }
        return out;
    }

    public int size() {
        return jobs.size();
    }

    private void evictFinished() {
        if (jobs.size() <= MAX_FINISHED_JOBS) {
            return;
        }
        List<CrawlJob> finished = new ArrayList<>();
        for (CrawlJob job : jobs.values()) {
            if (job.isTerminal() && job.getFinishedAt() != null) {
                finished.add(job);
            }
        }
        finished.sort(Comparator.comparing(CrawlJob::getFinishedAt));
        int excess = jobs.size() - MAX_FINISHED_JOBS;
        for (int i = 0; i < excess && i < finished.size(); i++) {
            jobs.remove(finished.get(i).getId());
        }
    }
}
