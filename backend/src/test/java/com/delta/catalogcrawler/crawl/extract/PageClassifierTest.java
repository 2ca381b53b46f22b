package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.PageClassification;
import com.delta.catalogcrawler.crawl.model.PageType;
import com.delta.catalogcrawler.crawl.model.Platform;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageClassifierTest {
    private final PageClassifier classifier = new PageClassifier(new PlatformDetector(), new JsonLdReader(new ObjectMapper()));

    @Test
    void singleLinkedDataProductIsProductPage() {
        Document document = parse(
            """
                <html><head><script type="application/ld+json">{"@type":"Product","name":"Lamp"}</script></head>
                <body><h1>Lamp</h1></body></html>
                """,
            "https://example.com/lamp"
        );

        assertThat(classifier.classify(document, "https://example.com/lamp").pageType()).isEqualTo(PageType.PRODUCT);
    }

    @Test
    void itemListIsListingPage() {
        Document document = parse(
            """
                <html><head><script type="application/ld+json">
                {"@type":"ItemList","itemListElement":[{"@type":"ListItem","url":"/a"},{"@type":"ListItem","url":"/b"}]}
                </script></head><body></body></html>
                """,
            "https://example.com/all"
        );

        assertThat(classifier.classify(document, "https://example.com/all").pageType()).isEqualTo(PageType.LISTING);
    }

    @Test
    void productPathWithPriceIsProductPage() {
        String url = "https://example.com/products/desk-lamp";
        Document document = parse("<html><body><h1>Desk lamp</h1><p>Only $45.00 today</p></body></html>", url);

        assertThat(classifier.classify(document, url).pageType()).isEqualTo(PageType.PRODUCT);
    }

    @Test
    void categoryPathIsListingPage() {
        String url = "https://example.com/category/lamps";
        Document document = parse("<html><body><h1>Lamps</h1></body></html>", url);

        assertThat(classifier.classify(document, url).pageType()).isEqualTo(PageType.LISTING);
    }

    @Test
    void plainPageIsGeneric() {
        String url = "https://example.com/about";
        Document document = parse("<html><body><h1>About us</h1><p>We make lamps.</p></body></html>", url);

        PageClassification classification = classifier.classify(document, url);
        assertThat(classification.pageType()).isEqualTo(PageType.GENERIC);
        assertThat(classification.platform()).isEqualTo(Platform.UNKNOWN);
    }

    @Test
    void classificationIsStableForSameInput() {
        String url = "https://example.com/category/lamps";
        String html = "<html><body><li class=\"product\"><a href=\"/p/1\">One</a></li></body></html>";

        PageClassification first = classifier.classify(parse(html, url), url);
        PageClassification second = classifier.classify(parse(html, url), url);
        assertThat(second).isEqualTo(first);
    }

    private static Document parse(String html, String url) {
        return Jsoup.parse(html, url);
    }
}
