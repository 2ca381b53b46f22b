package com.delta.catalogcrawler.crawl.events;

import com.delta.catalogcrawler.crawl.model.JobCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class JobEventLogger {
    private static final Logger log = LoggerFactory.getLogger(JobEventLogger.class);

    @EventListener
    public void onJobCompleted(JobCompletedEvent event) {
        log.info("Job finished jobId={} domain={} status={} pagesVisited={} productsFound={} errors={}",
            event.jobId(), event.domain(), event.status(), event.pagesVisited(), event.productsFound(), event.errorCount());
    }
}
