package com.delta.catalogcrawler.crawl.queue;

/**
 * Reports how full the worker heap is, as a fraction in [0, 1].
 */
@FunctionalInterface
public interface MemoryProbe {

    double heapUsageRatio();
}
