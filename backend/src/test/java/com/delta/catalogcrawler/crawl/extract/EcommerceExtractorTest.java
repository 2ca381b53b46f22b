package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.ExtractionResult;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.PatternKey;
import com.delta.catalogcrawler.crawl.model.PatternRecord;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EcommerceExtractorTest {
    private static final String PRODUCT_PAGE =
        """
            <html><head><title>Trail Runner 2</title>
            <script type="application/ld+json">
            {
              "@context": "https://schema.org",
              "@type": "Product",
              "name": "Trail Runner 2",
              "sku": "TR-2",
              "image": ["https://shop.example.com/img/tr2.jpg"],
              "brand": {"@type": "Brand", "name": "Acme"},
              "offers": {
                "@type": "Offer",
                "price": "129.00",
                "priceCurrency": "USD",
                "availability": "https://schema.org/InStock"
              }
            }
            </script></head>
            <body><h1>Trail Runner 2</h1><p>A light shoe for long days on rough ground, built for grip.</p></body></html>
            """;

    private static final String LISTING_PAGE =
        """
            <html><head><title>Shoes</title>
            <link rel="next" href="/collections/shoes?page=2"></head>
            <body>
            <ul class="products">
              <li class="product"><a href="/products/alpha"><h2>Alpha</h2></a><span class="price">$19.99</span></li>
              <li class="product"><a href="/products/beta"><h2>Beta</h2></a><span class="price">$24.99</span></li>
              <li class="product"><a href="/products/gamma"><h2>Gamma</h2></a><span class="price">$29.99</span></li>
            </ul>
            </body></html>
            """;

    private static final String ARTICLE_PAGE =
        """
            <html><head><title>How we test shoes</title>
            <meta property="og:type" content="article">
            <meta property="article:published_time" content="2024-03-05T10:00:00Z"></head>
            <body><article>
            <p>Every pair we sell goes through a long week of testing on roads, trails, and gravel paths.</p>
            <p>We measure wear on the outsole, check stitching, and look at how the upper holds up in the rain.</p>
            </article></body></html>
            """;

    private final ExtractorFixture fixture = new ExtractorFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void extractsProductFromLinkedData() {
        ExtractionResult result = fixture.extractor.extract(PRODUCT_PAGE, "https://www.shop.example.com/products/trail-runner-2");

        assertThat(result.pageType()).isEqualTo(PageType.PRODUCT);
        assertThat(result.strategy()).isEqualTo(ExtractionStrategy.JSON_LD);
        assertThat(result.lowQuality()).isFalse();
        assertThat(result.confidence()).isGreaterThan(0.9);
        assertThat(result.products()).hasSize(1);
        RawProduct product = result.products().get(0);
        assertThat(product.name()).isEqualTo("Trail Runner 2");
        assertThat(product.sku()).isEqualTo("TR-2");
        assertThat(product.rawPrice()).isEqualTo("129.00 USD");
        assertThat(product.brand()).isEqualTo("Acme");
        assertThat(product.images()).containsExactly("https://shop.example.com/img/tr2.jpg");
    }

    @Test
    void productExtractionTeachesThePatternCache() {
        fixture.extractor.extract(PRODUCT_PAGE, "https://www.shop.example.com/products/trail-runner-2");

        PatternRecord learned = fixture.patternCache.get(new PatternKey("shop.example.com", PageType.PRODUCT)).orElseThrow();
        assertThat(learned.strategy()).isEqualTo(ExtractionStrategy.JSON_LD);
        assertThat(learned.confidence()).isBetween(0.0, 1.0);
        assertThat(learned.successCount()).isEqualTo(1);
    }

    @Test
    void extractsListingCardsAndNextPage() {
        ExtractionResult result = fixture.extractor.extract(LISTING_PAGE, "https://shop.example.com/collections/shoes");

        assertThat(result.pageType()).isEqualTo(PageType.LISTING);
        assertThat(result.strategy()).isEqualTo(ExtractionStrategy.DOM_HEURISTICS);
        assertThat(result.products()).extracting(RawProduct::name).containsExactly("Alpha", "Beta", "Gamma");
        assertThat(result.products()).extracting(RawProduct::rawPrice).containsExactly("$19.99", "$24.99", "$29.99");
        assertThat(result.pagination().hasNext()).isTrue();
        assertThat(result.pagination().nextUrl()).contains("/collections/shoes?page=2");
        assertThat(result.productLinks()).hasSize(3);
        assertThat(result.productLinks()).allMatch(link -> link.contains("/products/"));
    }

    @Test
    void articleFallsBackToBaseContent() {
        ExtractionResult result = fixture.extractor.extract(ARTICLE_PAGE, "https://shop.example.com/blog/how-we-test");

        assertThat(result.pageType()).isEqualTo(PageType.ARTICLE);
        assertThat(result.strategy()).isEqualTo(ExtractionStrategy.BASE_CONTENT);
        assertThat(result.products()).isEmpty();
        assertThat(result.title()).isEqualTo("How we test shoes");
        assertThat(result.cleanedText()).contains("outsole");
        assertThat(result.publishedDate()).hasToString("2024-03-05");
    }

    @Test
    void sameInputGivesSameContentHash() {
        String url = "https://shop.example.com/blog/how-we-test";
        ExtractionResult first = fixture.extractor.extract(ARTICLE_PAGE, url);
        ExtractionResult second = fixture.extractor.extract(ARTICLE_PAGE, url);

        assertThat(first.contentHash()).isNotBlank();
        assertThat(second.contentHash()).isEqualTo(first.contentHash());
        assertThat(second.pageType()).isEqualTo(first.pageType());
    }

    @Test
    void emptyDocumentStillYieldsAResult() {
        ExtractionResult result = fixture.extractor.extract("", "https://shop.example.com/");

        assertThat(result.pageType()).isEqualTo(PageType.GENERIC);
        assertThat(result.lowQuality()).isTrue();
        assertThat(result.products()).isEmpty();
    }
}
