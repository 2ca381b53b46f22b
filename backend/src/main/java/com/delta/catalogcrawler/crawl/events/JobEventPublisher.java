package com.delta.catalogcrawler.crawl.events;

import com.delta.catalogcrawler.crawl.model.JobCompletedEvent;

/**
 * Outbound notification of finished jobs. Delivery and downstream handling belong to the implementation.
 */
public interface JobEventPublisher {

    void publish(JobCompletedEvent event);
}
