package com.delta.catalogcrawler.crawl.render;

import com.delta.catalogcrawler.crawl.model.RenderOptions;
import com.delta.catalogcrawler.crawl.model.RenderResult;

/**
 * Fetches and renders a page.
 * <p>
 * Never throws for fetch-level problems. Failures come back as a {@link RenderResult} with an
 * {@code errorCode} of {@code timeout}, {@code io_error}, {@code interrupted}, {@code invalid_url},
 * {@code too_large} or {@code disallowed_content_type}; HTTP errors come back as their status code.
 * A call returns no later than {@link RenderOptions#timeout()} after the request is sent.
 */
public interface PageRenderer {

    RenderResult render(String url, RenderOptions options);
}
