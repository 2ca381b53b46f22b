package com.delta.catalogcrawler.crawl.events;

import com.delta.catalogcrawler.crawl.model.JobCompletedEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
public class SpringJobEventPublisher implements JobEventPublisher {
    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringJobEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(JobCompletedEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
