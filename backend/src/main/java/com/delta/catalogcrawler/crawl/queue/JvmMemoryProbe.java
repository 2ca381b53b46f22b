package com.delta.catalogcrawler.crawl.queue;

import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

@Component
public class JvmMemoryProbe implements MemoryProbe {
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    @Override
    public double heapUsageRatio() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long limit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        if (limit <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) heap.getUsed() / limit);
    }
}
