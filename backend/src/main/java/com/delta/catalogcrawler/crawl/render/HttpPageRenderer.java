package com.delta.catalogcrawler.crawl.render;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.FetchedBytes;
import com.delta.catalogcrawler.crawl.model.RenderOptions;
import com.delta.catalogcrawler.crawl.model.RenderResult;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Flow;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Plain HTTP renderer. Pages are fetched without executing scripts or loading subresources.
 * Simultaneous renders are capped per concurrency class and requests to one host are spaced
 * by the politeness delay, which trusted renders skip.
 */
@Service
public class HttpPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(HttpPageRenderer.class);
    private static final Duration HOST_BACKOFF = Duration.ofSeconds(30);
    private static final String ACCEPT = "text/html,application/xhtml+xml;q=0.9,text/plain;q=0.5,*/*;q=0.1";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Map<ConcurrencyClass, Semaphore> classLimiters;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public HttpPageRenderer(CrawlerProperties properties, @Qualifier("renderExecutor") ExecutorService renderExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRender().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(renderExecutor)
            .build();
        this.classLimiters = Map.of(
            ConcurrencyClass.STANDARD, new Semaphore(properties.getRender().getStandardMaxConcurrentRenders(), true),
            ConcurrencyClass.TRUSTED, new Semaphore(properties.getRender().getTrustedMaxConcurrentRenders(), true)
        );
    }

    @Override
    public RenderResult render(String url, RenderOptions options) {
        Instant startedAt = Instant.now();
        ConcurrencyClass concurrencyClass = options == null || options.concurrencyClass() == null
            ? ConcurrencyClass.STANDARD
            : options.concurrencyClass();
        Duration timeout = options == null || options.timeout() == null
            ? Duration.ofSeconds(properties.getRender().getTimeoutSeconds())
            : options.timeout();
        int maxBytes = properties.getRender().getMaxPageBytes();
        Exchange exchange = exchange(url, concurrencyClass, timeout, ACCEPT, maxBytes, true);
        if (exchange.errorCode() != null) {
            return errorResult(url, startedAt, exchange.errorCode(), exchange.errorMessage());
        }
        HttpResponse<byte[]> response = exchange.response();
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        String finalUrl = response.uri() == null ? url : response.uri().toString();
        if (isSuccess(response.statusCode()) && !isAllowedContentType(contentType)) {
            return new RenderResult(url, finalUrl, response.statusCode(), null, contentType,
                FailureReasonClassifier.DISALLOWED_CONTENT_TYPE, "content type " + contentType,
                Instant.now(), Duration.between(startedAt, Instant.now()));
        }
        byte[] body = response.body();
        if (body == null) {
            return new RenderResult(url, finalUrl, response.statusCode(), null, contentType,
                FailureReasonClassifier.TOO_LARGE, "page exceeds " + maxBytes + " bytes",
                Instant.now(), Duration.between(startedAt, Instant.now()));
        }
        return new RenderResult(
            url,
            finalUrl,
            response.statusCode(),
            new String(body, charsetOf(contentType)),
            contentType,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now())
        );
    }

    /**
     * Raw response bytes of any content type, for documents that are not HTML pages (compressed sitemaps).
     * Same politeness, concurrency cap and deadline as {@link #render}.
     */
    public FetchedBytes fetchBytes(String url, String accept, int maxBytes) {
        Duration timeout = Duration.ofSeconds(properties.getRender().getTimeoutSeconds());
        Exchange exchange = exchange(url, ConcurrencyClass.STANDARD, timeout, accept, maxBytes, false);
        if (exchange.errorCode() != null) {
            return new FetchedBytes(url, null, 0, null, null, null, exchange.errorCode(), exchange.errorMessage());
        }
        HttpResponse<byte[]> response = exchange.response();
        String finalUrl = response.uri() == null ? url : response.uri().toString();
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        String contentEncoding = response.headers().firstValue("Content-Encoding").orElse(null);
        if (response.body() == null) {
            return new FetchedBytes(url, finalUrl, response.statusCode(), contentType, contentEncoding, null,
                FailureReasonClassifier.TOO_LARGE, "document exceeds " + maxBytes + " bytes");
        }
        return new FetchedBytes(url, finalUrl, response.statusCode(), contentType, contentEncoding, response.body(), null, null);
    }

    private Exchange exchange(
        String url,
        ConcurrencyClass concurrencyClass,
        Duration timeout,
        String accept,
        int maxBytes,
        boolean textOnly
    ) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null || !UrlNormalizer.isHttpScheme(uri.getScheme())) {
            return Exchange.failed(FailureReasonClassifier.INVALID_URL, "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        Semaphore limiter = classLimiters.get(concurrencyClass);
        boolean acquired = false;
        try {
            limiter.acquire();
            acquired = true;
            if (concurrencyClass != ConcurrencyClass.TRUSTED) {
                enforcePerHostDelay(host);
            }
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", CrawlerProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", accept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
            // the request timeout only covers the response headers; the whole body must arrive by the same deadline
            CompletableFuture<HttpResponse<byte[]>> pending = client.sendAsync(request, cappedBody(maxBytes, textOnly));
            HttpResponse<byte[]> response;
            try {
                response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                return Exchange.failed(FailureReasonClassifier.TIMEOUT, "no complete response within " + timeout.toMillis() + "ms");
            } catch (InterruptedException e) {
                pending.cancel(true);
                throw e;
            }
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                extendBackoff(host, HOST_BACKOFF);
            }
            return new Exchange(response, null, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return Exchange.failed(FailureReasonClassifier.TIMEOUT, cause.getMessage());
            }
            log.debug("Fetch failed url={}", url, cause);
            return Exchange.failed(FailureReasonClassifier.IO_ERROR, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Exchange.failed(FailureReasonClassifier.INTERRUPTED, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Fetch failed url={}", url, e);
            return Exchange.failed(FailureReasonClassifier.IO_ERROR, e.getMessage());
        } finally {
            if (acquired) {
                limiter.release();
            }
        }
    }

    static boolean isAllowedContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.startsWith("text/") || lower.contains("html") || lower.contains("xml");
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Oversized bodies are cut off and come back as null. With {@code textOnly}, bodies of disallowed content
     * types are discarded unread.
     */
    private static HttpResponse.BodyHandler<byte[]> cappedBody(int maxBytes, boolean textOnly) {
        return info -> {
            String contentType = info.headers().firstValue("Content-Type").orElse(null);
            if (textOnly && isSuccess(info.statusCode()) && !isAllowedContentType(contentType)) {
                return HttpResponse.BodySubscribers.<byte[]>replacing(null);
            }
            return new CappedBodySubscriber(maxBytes);
        };
    }

    private static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException ignored) {
                    // unknown charset names fall back to UTF-8
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getRender().getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {
        private final int maxBytes;
        private final CompletableFuture<byte[]> result = new CompletableFuture<>();
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private Flow.Subscription subscription;

        CappedBodySubscriber(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return result;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (result.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                int length = item.remaining();
                if (out.size() + length > maxBytes) {
                    result.complete(null);
                    subscription.cancel();
                    return;
                }
                byte[] chunk = new byte[length];
                item.get(chunk);
                out.write(chunk, 0, length);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            result.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            result.complete(out.toByteArray());
        }
    }

    private record Exchange(HttpResponse<byte[]> response, String errorCode, String errorMessage) {
        static Exchange failed(String errorCode, String errorMessage) {
            return new Exchange(null, errorCode, errorMessage);
        }
    }

    private RenderResult errorResult(String url, Instant startedAt, String code, String message) {
        return new RenderResult(url, null, 0, null, null, code, message, Instant.now(), Duration.between(startedAt, Instant.now()));
    }
}
