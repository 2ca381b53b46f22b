package com.delta.catalogcrawler.crawl.pagination;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.extract.ExtractorFixture;
import com.delta.catalogcrawler.crawl.model.CatalogCrawlOptions;
import com.delta.catalogcrawler.crawl.model.CatalogCrawlResult;
import com.delta.catalogcrawler.crawl.model.CatalogStopReason;
import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.model.FailureLedgerEntry;
import com.delta.catalogcrawler.crawl.normalize.ProductNormalizer;
import com.delta.catalogcrawler.crawl.queue.RetryPolicy;
import com.delta.catalogcrawler.crawl.render.HttpPageRenderer;
import com.delta.catalogcrawler.crawl.render.PageFetcher;
import com.delta.catalogcrawler.crawl.robots.RobotsPolicyService;
import com.delta.catalogcrawler.crawl.service.DomainPolicyService;
import com.delta.catalogcrawler.crawl.util.FailureReasonClassifier;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginationCrawlerTest {
    private MockWebServer server;
    private ExecutorService renderExecutor;
    private ExtractorFixture fixture;
    private PaginationCrawler crawler;
    private final Map<String, MockResponse> pages = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                hits.computeIfAbsent(path, ignored -> new AtomicInteger()).incrementAndGet();
                MockResponse response = pages.get(path);
                return response != null ? response : new MockResponse().setResponseCode(404).setBody("missing");
            }
        });
        server.start();

        fixture = new ExtractorFixture();
        CrawlerProperties properties = fixture.properties;
        properties.getRender().setTimeoutSeconds(5);
        properties.getRender().setPerHostDelayMs(0);
        properties.getPagination().setInterPageDelayMs(0);
        properties.getQueue().setRetryBaseDelayMs(1);
        properties.getQueue().setRetryMaxDelayMs(5);
        properties.getRobots().setEnabled(false);

        renderExecutor = Executors.newFixedThreadPool(2);
        HttpPageRenderer renderer = new HttpPageRenderer(properties, renderExecutor);
        PageFetcher fetcher = new PageFetcher(renderer, new RobotsPolicyService(properties, renderer), properties);
        crawler = new PaginationCrawler(
            fetcher,
            fixture.extractor,
            new ProductNormalizer(),
            new RetryPolicy(properties),
            new DomainPolicyService(properties),
            properties
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (renderExecutor != null) {
            renderExecutor.shutdownNow();
        }
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void followsNextLinksUntilABrokenLink() {
        page("/shop", listing(1, "/shop?page=2"));
        page("/shop?page=2", listing(2, "/shop?page=3"));
        page("/shop?page=3", listing(3, "/shop?page=4"));

        CatalogCrawlResult result = crawler.crawlCatalog(url("/shop"), new CatalogCrawlOptions(10, true));

        assertThat(result.pagesVisited()).isEqualTo(3);
        assertThat(result.stopReason()).isEqualTo(CatalogStopReason.NO_FURTHER_PAGINATION);
        assertThat(result.products()).hasSize(6);
        assertThat(result.errors()).hasSize(1);
        FailureLedgerEntry error = result.errors().get(0);
        assertThat(error.kind()).isEqualTo(CrawlErrorKind.TERMINAL_FETCH);
        assertThat(error.reasonCode()).isEqualTo(FailureReasonClassifier.HTTP_404);
        assertThat(error.url()).contains("page=4");
        assertThat(hits.get("/shop?page=4").get()).isEqualTo(1);
    }

    @Test
    void serverErrorsAreRetriedThenRecorded() {
        page("/shop", listing(1, "/shop?page=2"));
        pages.put("/shop?page=2", new MockResponse().setResponseCode(500).setBody("boom"));

        CatalogCrawlResult result = crawler.crawlCatalog(url("/shop"), new CatalogCrawlOptions(10, true));

        assertThat(hits.get("/shop?page=2").get()).isEqualTo(3);
        assertThat(result.pagesVisited()).isEqualTo(1);
        assertThat(result.products()).hasSize(2);
        assertThat(result.errors()).singleElement().satisfies(entry -> {
            assertThat(entry.kind()).isEqualTo(CrawlErrorKind.TERMINAL_FETCH);
            assertThat(entry.reasonCode()).isEqualTo(FailureReasonClassifier.HTTP_5XX);
            assertThat(entry.attempts()).isEqualTo(3);
        });
    }

    @Test
    void stopsAtMaxPages() {
        page("/shop", listing(1, "/shop?page=2"));
        page("/shop?page=2", listing(2, "/shop?page=3"));
        page("/shop?page=3", listing(3, null));

        CatalogCrawlResult result = crawler.crawlCatalog(url("/shop"), new CatalogCrawlOptions(2, true));

        assertThat(result.pagesVisited()).isEqualTo(2);
        assertThat(result.stopReason()).isEqualTo(CatalogStopReason.MAX_PAGES_REACHED);
        assertThat(hits).doesNotContainKey("/shop?page=3");
    }

    @Test
    void stopsWhenPagesRepeatTheSameProducts() {
        page("/shop", listing(1, "/shop?page=2"));
        page("/shop?page=2", listing(1, "/shop?page=3"));
        page("/shop?page=3", listing(1, "/shop?page=4"));
        page("/shop?page=4", listing(1, "/shop?page=5"));
        page("/shop?page=5", listing(5, null));

        CatalogCrawlResult result = crawler.crawlCatalog(url("/shop"), new CatalogCrawlOptions(20, true));

        assertThat(result.stopReason()).isEqualTo(CatalogStopReason.STALLED);
        assertThat(result.pagesVisited()).isEqualTo(4);
        assertThat(result.products()).hasSize(2);
    }

    @Test
    void doesNotFollowNextLinkToAnotherSite() {
        page("/shop", listing(1, "http://outlet.example.net/shop?page=2"));

        CatalogCrawlResult result = crawler.crawlCatalog(url("/shop"), new CatalogCrawlOptions(10, true));

        assertThat(result.pagesVisited()).isEqualTo(1);
        assertThat(result.stopReason()).isEqualTo(CatalogStopReason.NO_FURTHER_PAGINATION);
        assertThat(result.products()).hasSize(2);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void singlePageWhenPaginationIsOff() {
        page("/shop", listing(1, "/shop?page=2"));
        page("/shop?page=2", listing(2, null));

        CatalogCrawlResult result = crawler.crawlCatalog(url("/shop"), new CatalogCrawlOptions(10, false));

        assertThat(result.pagesVisited()).isEqualTo(1);
        assertThat(result.stopReason()).isEqualTo(CatalogStopReason.NO_FURTHER_PAGINATION);
    }

    @Test
    void failingStartPageIsReported() {
        CatalogCrawlResult result = crawler.crawlCatalog(url("/gone"), new CatalogCrawlOptions(10, true));

        assertThat(result.pagesVisited()).isZero();
        assertThat(result.stopReason()).isEqualTo(CatalogStopReason.FETCH_FAILED);
        assertThat(result.products()).isEmpty();
    }

    @Test
    void rejectsNonHttpStartUrl() {
        assertThatThrownBy(() -> crawler.crawlCatalog("ftp://example.com/shop", new CatalogCrawlOptions(10, true)))
            .isInstanceOf(InvalidRequestException.class);
    }

    private void page(String path, String html) {
        pages.put(path, new MockResponse().setHeader("Content-Type", "text/html; charset=utf-8").setBody(html));
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    private static String listing(int page, String nextPath) {
        String next = nextPath == null ? "" : "<link rel=\"next\" href=\"" + nextPath + "\">";
        return "<html><head><title>Shop page " + page + "</title>" + next + "</head><body><ul>"
            + card(page, "a", "12.00")
            + card(page, "b", "15.50")
            + "</ul></body></html>";
    }

    private static String card(int page, String suffix, String price) {
        String slug = "p" + page + "-" + suffix;
        return "<li class=\"product\"><a href=\"/products/" + slug + "\"><h2>Product " + slug + "</h2></a>"
            + "<span class=\"price\">$" + price + "</span></li>";
    }
}
