package com.delta.catalogcrawler.crawl.api;

import com.delta.catalogcrawler.crawl.model.QueueStatusResponse;
import com.delta.catalogcrawler.crawl.queue.QueueWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/queue")
public class QueueController {
    private final QueueWorkerService queueWorkerService;

    public QueueController(QueueWorkerService queueWorkerService) {
        this.queueWorkerService = queueWorkerService;
    }

    @PostMapping("/start")
    public QueueStatusResponse start() {
        queueWorkerService.start();
        return queueWorkerService.getStatus();
    }

    @PostMapping("/stop")
    public QueueStatusResponse stop() {
        queueWorkerService.stop();
        return queueWorkerService.getStatus();
    }

    @GetMapping("/status")
    public QueueStatusResponse status() {
        return queueWorkerService.getStatus();
    }
}
