package com.delta.catalogcrawler.crawl.render;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.TerminalFetchException;
import com.delta.catalogcrawler.crawl.error.TransientFetchException;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.RenderOptions;
import com.delta.catalogcrawler.crawl.model.RenderResult;
import com.delta.catalogcrawler.crawl.robots.RobotsPolicyService;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * One robots-checked render attempt that turns every unsuccessful outcome into a typed fetch failure.
 */
@Service
public class PageFetcher {
    private final PageRenderer renderer;
    private final RobotsPolicyService robotsPolicyService;
    private final CrawlerProperties properties;

    public PageFetcher(PageRenderer renderer, RobotsPolicyService robotsPolicyService, CrawlerProperties properties) {
        this.renderer = renderer;
        this.robotsPolicyService = robotsPolicyService;
        this.properties = properties;
    }

    /**
     * @return a successful render with an HTML body
     * @throws TransientFetchException for failures worth retrying (timeouts, 5xx, 429, I/O)
     * @throws TerminalFetchException for everything else (404, robots-disallowed, content type, size)
     */
    public RenderResult fetch(String url, ConcurrencyClass concurrencyClass) {
        if (!robotsPolicyService.isAllowed(url, concurrencyClass)) {
            throw new TerminalFetchException(FailureReasonClassifier.ROBOTS_BLOCKED, 0, "disallowed by robots.txt: " + url);
        }
        RenderOptions options = new RenderOptions(
            properties.getRender().isBlockResources(),
            Duration.ofSeconds(properties.getRender().getTimeoutSeconds()),
            concurrencyClass
        );
        RenderResult result = renderer.render(url, options);
        if (result.isSuccessful()) {
            return result;
        }
        String reason = FailureReasonClassifier.classify(result);
        String message = result.errorMessage() != null
            ? result.errorMessage()
            : "HTTP " + result.statusCode() + " for " + url;
        if (FailureReasonClassifier.isRetryable(reason)) {
            throw new TransientFetchException(reason, result.statusCode(), message);
        }
        throw new TerminalFetchException(reason, result.statusCode(), message);
    }
}
