package com.delta.catalogcrawler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "CatalogCrawler/1.0 (+contact)";

    private String userAgent;
    private List<String> trustedDomains = new ArrayList<>();
    private List<String> blockedDomains = new ArrayList<>();
    private Render render = new Render();
    private Queue queue = new Queue();
    private Memory memory = new Memory();
    private Extraction extraction = new Extraction();
    private Pattern pattern = new Pattern();
    private Pagination pagination = new Pagination();
    private Job job = new Job();
    private Persistence persistence = new Persistence();
    private Robots robots = new Robots();
    private Sitemap sitemap = new Sitemap();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public List<String> getTrustedDomains() {
        return trustedDomains;
    }

    public void setTrustedDomains(List<String> trustedDomains) {
        this.trustedDomains = normalizeDomains(trustedDomains);
    }

    public List<String> getBlockedDomains() {
        return blockedDomains;
    }

    public void setBlockedDomains(List<String> blockedDomains) {
        this.blockedDomains = normalizeDomains(blockedDomains);
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Memory getMemory() {
        return memory;
    }

    public void setMemory(Memory memory) {
        this.memory = memory;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public void setPattern(Pattern pattern) {
        this.pattern = pattern;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static List<String> normalizeDomains(List<String> domains) {
        List<String> out = new ArrayList<>();
        if (domains == null) {
            return out;
        }
        for (String domain : domains) {
            if (domain != null && !domain.isBlank()) {
                out.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    public static class Render {
        private int timeoutSeconds = 20;
        private int maxPageBytes = 10 * 1024 * 1024;
        private int standardMaxConcurrentRenders = 2;
        private int trustedMaxConcurrentRenders = 8;
        private int perHostDelayMs = 1000;
        private boolean blockResources = true;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxPageBytes() {
            return Math.max(1024, maxPageBytes);
        }

        public void setMaxPageBytes(int maxPageBytes) {
            this.maxPageBytes = maxPageBytes;
        }

        public int getStandardMaxConcurrentRenders() {
            return Math.max(1, standardMaxConcurrentRenders);
        }

        public void setStandardMaxConcurrentRenders(int standardMaxConcurrentRenders) {
            this.standardMaxConcurrentRenders = standardMaxConcurrentRenders;
        }

        public int getTrustedMaxConcurrentRenders() {
            return Math.max(1, trustedMaxConcurrentRenders);
        }

        public void setTrustedMaxConcurrentRenders(int trustedMaxConcurrentRenders) {
            this.trustedMaxConcurrentRenders = trustedMaxConcurrentRenders;
        }

        public int getPerHostDelayMs() {
            return Math.max(0, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = perHostDelayMs;
        }

        public boolean isBlockResources() {
            return blockResources;
        }

        public void setBlockResources(boolean blockResources) {
            this.blockResources = blockResources;
        }
    }

    public static class Queue {
        private int standardWorkers = 2;
        private int trustedWorkers = 6;
        private int standardPerJobInFlight = 2;
        private int trustedPerJobInFlight = 5;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 1000;
        private long retryMaxDelayMs = 30000;
        private int dedupWindowSeconds = 600;
        private int maxWaitPromotionSeconds = 120;
        private double errorRatioThreshold = 0.5;
        private int shutdownGraceSeconds = 30;
        private long pollIntervalMs = 250;
        private boolean autoStart = true;
        private boolean resumeOnStartup = true;

        public int getStandardWorkers() {
            return Math.max(1, standardWorkers);
        }

        public void setStandardWorkers(int standardWorkers) {
            this.standardWorkers = standardWorkers;
        }

        public int getTrustedWorkers() {
            return Math.max(1, trustedWorkers);
        }

        public void setTrustedWorkers(int trustedWorkers) {
            this.trustedWorkers = trustedWorkers;
        }

        public int getStandardPerJobInFlight() {
            return Math.max(1, standardPerJobInFlight);
        }

        public void setStandardPerJobInFlight(int standardPerJobInFlight) {
            this.standardPerJobInFlight = standardPerJobInFlight;
        }

        public int getTrustedPerJobInFlight() {
            return Math.max(1, trustedPerJobInFlight);
        }

        public void setTrustedPerJobInFlight(int trustedPerJobInFlight) {
            this.trustedPerJobInFlight = trustedPerJobInFlight;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return Math.max(1L, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public int getDedupWindowSeconds() {
            return Math.max(1, dedupWindowSeconds);
        }

        public void setDedupWindowSeconds(int dedupWindowSeconds) {
            this.dedupWindowSeconds = dedupWindowSeconds;
        }

        public int getMaxWaitPromotionSeconds() {
            return Math.max(1, maxWaitPromotionSeconds);
        }

        public void setMaxWaitPromotionSeconds(int maxWaitPromotionSeconds) {
            this.maxWaitPromotionSeconds = maxWaitPromotionSeconds;
        }

        public double getErrorRatioThreshold() {
            return Math.min(1.0, Math.max(0.0, errorRatioThreshold));
        }

        public void setErrorRatioThreshold(double errorRatioThreshold) {
            this.errorRatioThreshold = errorRatioThreshold;
        }

        public int getShutdownGraceSeconds() {
            return Math.max(1, shutdownGraceSeconds);
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = shutdownGraceSeconds;
        }

        public long getPollIntervalMs() {
            return Math.max(10L, pollIntervalMs);
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public boolean isResumeOnStartup() {
            return resumeOnStartup;
        }

        public void setResumeOnStartup(boolean resumeOnStartup) {
            this.resumeOnStartup = resumeOnStartup;
        }
    }

    public static class Memory {
        private double highWaterRatio = 0.85;
        private long checkIntervalMs = 5000;
        private int requeueBatchSize = 10;
        private long requeueDelayMs = 15000;
        private int restartAfterConsecutiveChecks = 3;

        public double getHighWaterRatio() {
            return Math.min(0.99, Math.max(0.1, highWaterRatio));
        }

        public void setHighWaterRatio(double highWaterRatio) {
            this.highWaterRatio = highWaterRatio;
        }

        public long getCheckIntervalMs() {
            return Math.max(100L, checkIntervalMs);
        }

        public void setCheckIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
        }

        public int getRequeueBatchSize() {
            return Math.max(1, requeueBatchSize);
        }

        public void setRequeueBatchSize(int requeueBatchSize) {
            this.requeueBatchSize = requeueBatchSize;
        }

        public long getRequeueDelayMs() {
            return Math.max(0L, requeueDelayMs);
        }

        public void setRequeueDelayMs(long requeueDelayMs) {
            this.requeueDelayMs = requeueDelayMs;
        }

        public int getRestartAfterConsecutiveChecks() {
            return Math.max(1, restartAfterConsecutiveChecks);
        }

        public void setRestartAfterConsecutiveChecks(int restartAfterConsecutiveChecks) {
            this.restartAfterConsecutiveChecks = restartAfterConsecutiveChecks;
        }
    }

    public static class Extraction {
        private int minWordCount = 50;
        private double completenessThreshold = 0.6;

        public int getMinWordCount() {
            return Math.max(1, minWordCount);
        }

        public void setMinWordCount(int minWordCount) {
            this.minWordCount = minWordCount;
        }

        public double getCompletenessThreshold() {
            return Math.min(1.0, Math.max(0.0, completenessThreshold));
        }

        public void setCompletenessThreshold(double completenessThreshold) {
            this.completenessThreshold = completenessThreshold;
        }
    }

    public static class Pattern {
        private double highConfidenceThreshold = 0.8;
        private double initialConfidence = 0.5;
        private double learningRate = 0.25;
        private double failureDecay = 0.5;
        private int invalidateAfterFailures = 3;

        public double getHighConfidenceThreshold() {
            return clampUnit(highConfidenceThreshold);
        }

        public void setHighConfidenceThreshold(double highConfidenceThreshold) {
            this.highConfidenceThreshold = highConfidenceThreshold;
        }

        public double getInitialConfidence() {
            return clampUnit(initialConfidence);
        }

        public void setInitialConfidence(double initialConfidence) {
            this.initialConfidence = initialConfidence;
        }

        public double getLearningRate() {
            return clampUnit(learningRate);
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public double getFailureDecay() {
            return clampUnit(failureDecay);
        }

        public void setFailureDecay(double failureDecay) {
            this.failureDecay = failureDecay;
        }

        public int getInvalidateAfterFailures() {
            return Math.max(1, invalidateAfterFailures);
        }

        public void setInvalidateAfterFailures(int invalidateAfterFailures) {
            this.invalidateAfterFailures = invalidateAfterFailures;
        }

        private static double clampUnit(double value) {
            return Math.min(1.0, Math.max(0.0, value));
        }
    }

    public static class Sitemap {
        private boolean enabledByDefault = false;
        private int maxDepth = 2;
        private int maxSitemaps = 10;
        private int maxBytes = 2_000_000;

        public boolean isEnabledByDefault() {
            return enabledByDefault;
        }

        public void setEnabledByDefault(boolean enabledByDefault) {
            this.enabledByDefault = enabledByDefault;
        }

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getMaxSitemaps() {
            return Math.max(1, maxSitemaps);
        }

        public void setMaxSitemaps(int maxSitemaps) {
            this.maxSitemaps = maxSitemaps;
        }

        public int getMaxBytes() {
            return Math.max(1024, maxBytes);
        }

        public void setMaxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
        }
    }

    public static class Pagination {
        private long interPageDelayMs = 1000;
        private int stallPageLimit = 3;

        public long getInterPageDelayMs() {
            return Math.max(0L, interPageDelayMs);
        }

        public void setInterPageDelayMs(long interPageDelayMs) {
            this.interPageDelayMs = interPageDelayMs;
        }

        public int getStallPageLimit() {
            return Math.max(1, stallPageLimit);
        }

        public void setStallPageLimit(int stallPageLimit) {
            this.stallPageLimit = stallPageLimit;
        }
    }

    public static class Job {
        private int defaultMaxPages = 50;
        private int maxPagesCap = 1000;
        private int defaultTimeoutSeconds = 1800;
        private long timeoutCheckIntervalMs = 1000;
        private int defaultPriority = 5;

        public int getDefaultMaxPages() {
            return Math.max(1, defaultMaxPages);
        }

        public void setDefaultMaxPages(int defaultMaxPages) {
            this.defaultMaxPages = defaultMaxPages;
        }

        public int getMaxPagesCap() {
            return Math.max(getDefaultMaxPages(), maxPagesCap);
        }

        public void setMaxPagesCap(int maxPagesCap) {
            this.maxPagesCap = maxPagesCap;
        }

        public int getDefaultTimeoutSeconds() {
            return Math.max(1, defaultTimeoutSeconds);
        }

        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        }

        public long getTimeoutCheckIntervalMs() {
            return Math.max(50L, timeoutCheckIntervalMs);
        }

        public void setTimeoutCheckIntervalMs(long timeoutCheckIntervalMs) {
            this.timeoutCheckIntervalMs = timeoutCheckIntervalMs;
        }

        public int getDefaultPriority() {
            return Math.min(10, Math.max(1, defaultPriority));
        }

        public void setDefaultPriority(int defaultPriority) {
            this.defaultPriority = defaultPriority;
        }
    }

    public static class Persistence {
        private int backpressureThreshold = 500;
        private long backpressureWaitMs = 2000;

        public int getBackpressureThreshold() {
            return Math.max(1, backpressureThreshold);
        }

        public void setBackpressureThreshold(int backpressureThreshold) {
            this.backpressureThreshold = backpressureThreshold;
        }

        public long getBackpressureWaitMs() {
            return Math.max(0L, backpressureWaitMs);
        }

        public void setBackpressureWaitMs(long backpressureWaitMs) {
            this.backpressureWaitMs = backpressureWaitMs;
        }
    }

    public static class Robots {
        private boolean enabled = true;
        private boolean failOpen = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }
    }
}
