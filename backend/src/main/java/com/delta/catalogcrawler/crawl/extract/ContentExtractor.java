package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ContentExtraction;
import com.delta.catalogcrawler.crawl.util.HashUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Readability-style extraction: strips page chrome, scores text blocks by paragraph density
 * and keeps the best-scoring container as the main content.
 */
@Component
public class ContentExtractor {
    private static final String NOISE_TAGS =
        "script, style, noscript, iframe, svg, template, form, nav, header, footer, aside, button, select, input";
    private static final Pattern NOISE_CLASS = Pattern.compile(
        "(^|[-_\\s])(nav|navbar|menu|footer|header|sidebar|breadcrumbs?|cookie|consent|banner|advert|ads?|promo"
            + "|share|social|newsletter|popup|modal|comments?|related|widget)s?([-_\\s]|$)"
    );
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern JSON_LD_PUBLISHED = Pattern.compile("\"datePublished\"\\s*:\\s*\"([^\"]+)\"");
    private static final int MIN_PARAGRAPH_CHARS = 25;
    private static final int MAX_IMAGES = 20;

    private final CrawlerProperties properties;

    public ContentExtractor(CrawlerProperties properties) {
        this.properties = properties;
    }

    public ContentExtraction extract(String html, String url) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        return extract(document);
    }

    public ContentExtraction extract(Document document) {
        String title = extractTitle(document);
        LocalDate publishedDate = extractPublishedDate(document);

        Document working = document.clone();
        removeNoise(working);
        Element main = selectMainContent(working);
        String cleanedText = main == null ? "" : normalizeWhitespace(main.text());

        Set<String> images = new LinkedHashSet<>();
        Element ogImage = document.selectFirst("meta[property=og:image]");
        if (ogImage != null && !ogImage.attr("abs:content").isBlank()) {
            images.add(ogImage.attr("abs:content"));
        }
        if (main != null) {
            images.addAll(DomSupport.images(main, List.of("img")));
        }
        List<String> imageList = new ArrayList<>(images);
        if (imageList.size() > MAX_IMAGES) {
            imageList = imageList.subList(0, MAX_IMAGES);
        }

        int wordCount = cleanedText.isEmpty() ? 0 : cleanedText.split("\\s+").length;
        boolean lowQuality = wordCount < properties.getExtraction().getMinWordCount();
        String contentHash = HashUtils.sha256Hex(title == null ? "" : title, cleanedText);
        return new ContentExtraction(title, cleanedText, List.copyOf(imageList), publishedDate, contentHash, wordCount, lowQuality);
    }

    private String extractTitle(Document document) {
        Element ogTitle = document.selectFirst("meta[property=og:title]");
        if (ogTitle != null && !ogTitle.attr("content").isBlank()) {
            return ogTitle.attr("content").trim();
        }
        if (!document.title().isBlank()) {
            return document.title().trim();
        }
        Element h1 = document.selectFirst("h1");
        return h1 == null || h1.text().isBlank() ? null : h1.text().trim();
    }

    private LocalDate extractPublishedDate(Document document) {
        List<String> candidates = new ArrayList<>();
        for (Element meta : document.select(
            "meta[property=article:published_time], meta[name=date], meta[name=pubdate], "
                + "meta[itemprop=datePublished], meta[name=dc.date]"
        )) {
            candidates.add(meta.attr("content"));
        }
        for (Element time : document.select("[itemprop=datePublished], time[datetime]")) {
            candidates.add(DomSupport.firstNonBlank(time.attr("datetime"), time.attr("content"), time.text()));
        }
        for (Element script : document.select("script[type=application/ld+json]")) {
            Matcher matcher = JSON_LD_PUBLISHED.matcher(script.data());
            if (matcher.find()) {
                candidates.add(matcher.group(1));
            }
        }
        for (String candidate : candidates) {
            LocalDate parsed = parseDate(candidate);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = ISO_DATE.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        try {
            return LocalDate.parse(matcher.group(1));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void removeNoise(Document working) {
        working.select(NOISE_TAGS).remove();
        List<Element> noisy = new ArrayList<>();
        for (Element element : working.body() == null ? List.<Element>of() : working.body().getAllElements()) {
            if (element == working.body() || element.is("main, article")) {
                continue;
            }
            if (DomSupport.classOrIdMatches(element, NOISE_CLASS)) {
                noisy.add(element);
            }
        }
        for (Element element : noisy) {
            element.remove();
        }
    }

    private Element selectMainContent(Document working) {
        Element body = working.body();
        if (body == null) {
            return null;
        }
        Map<Element, Double> scores = new IdentityHashMap<>();
        for (Element paragraph : body.select("p, pre, td, li, blockquote")) {
            String text = paragraph.text();
            if (text.length() < MIN_PARAGRAPH_CHARS) {
                continue;
            }
            double score = 1.0 + countCommas(text) + Math.min(text.length() / 100.0, 3.0);
            Element parent = paragraph.parent();
            if (parent != null) {
                scores.merge(parent, score, Double::sum);
                Element grandParent = parent.parent();
                if (grandParent != null) {
                    scores.merge(grandParent, score / 2.0, Double::sum);
                }
            }
        }

        Element best = null;
        double bestScore = 0;
        for (Map.Entry<Element, Double> entry : scores.entrySet()) {
            Element candidate = entry.getKey();
            double score = entry.getValue() * (1.0 - linkDensity(candidate));
            if (candidate.is("article, main, [role=main]")) {
                score *= 1.25;
            }
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best == null ? body : best;
    }

    private double linkDensity(Element element) {
        int textLength = element.text().length();
        if (textLength == 0) {
            return 1.0;
        }
        int linkLength = element.select("a").text().length();
        return Math.min(1.0, (double) linkLength / textLength);
    }

    private int countCommas(String text) {
        int commas = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ',') {
                commas++;
            }
        }
        return commas;
    }

    private static String normalizeWhitespace(String text) {
        return text == null ? "" : text.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    }
}
