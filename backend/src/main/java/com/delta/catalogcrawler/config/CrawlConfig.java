package com.delta.catalogcrawler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CrawlConfig {

    @Bean(name = "renderExecutor", destroyMethod = "shutdown")
    public ExecutorService renderExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getRender().getTrustedMaxConcurrentRenders()
            + properties.getRender().getStandardMaxConcurrentRenders());
        return Executors.newFixedThreadPool(size, namedDaemonThreads("render-http"));
    }

    @Bean(name = "persistenceExecutor", destroyMethod = "shutdown")
    public ExecutorService persistenceExecutor() {
        return Executors.newSingleThreadExecutor(namedDaemonThreads("store-writer"));
    }

    @Bean(name = "patternLoadExecutor", destroyMethod = "shutdown")
    public ExecutorService patternLoadExecutor() {
        return Executors.newFixedThreadPool(2, namedDaemonThreads("pattern-load"));
    }

    @Bean(name = "crawlScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService crawlScheduler() {
        return Executors.newScheduledThreadPool(2, namedDaemonThreads("crawl-scheduler"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
