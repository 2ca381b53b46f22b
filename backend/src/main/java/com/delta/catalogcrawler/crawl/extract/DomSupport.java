package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DomSupport {
    private static final String AMOUNT = "(?:\\d{1,3}(?:[.,\\s']\\d{3})+(?:[.,]\\d{1,2})?|\\d+(?:[.,]\\d{1,2})?)";
    public static final Pattern PRICE_TEXT = Pattern.compile(
        "(?:[$£€¥₹]|R\\$|C\\$|A\\$|\\b(?:USD|GBP|EUR|CAD|AUD|JPY|INR|SEK|NOK|DKK|PLN|CHF)\\b)\\s?" + AMOUNT
            + "|" + AMOUNT + "\\s?(?:[€£$]|kr|zł|\\b(?:USD|GBP|EUR|SEK|NOK|DKK|PLN|CHF)\\b)"
    );
    public static final Pattern SKU_TEXT = Pattern.compile("(?i)\\b(?:sku|item no\\.?|product code|art\\.? ?nr\\.?)\\s*[:#]?\\s*((?=[A-Z\\-_./]*\\d)[A-Z0-9][A-Z0-9\\-_./]{2,40})");
    public static final Pattern TOTAL_COUNT = Pattern.compile(
        "(?i)(?:of|from)\\s+([\\d,.]+)\\s+(?:results|products|items)|([\\d,.]+)\\s+(?:results|products|items)\\b"
    );

    private static final int MAX_IMAGES = 20;

    private DomSupport() {
    }

    public static String firstText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            for (Element element : root.select(selector)) {
                String value = firstNonBlank(element.attr("content"), element.attr("data-product-name"), element.text());
                if (value != null) {
                    return value.trim();
                }
            }
        }
        return null;
    }

    public static Element firstElement(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Element element = root.selectFirst(selector);
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    public static String imageSource(Element image) {
        String src = firstNonBlank(
            image.attr("abs:data-large_image"),
            image.attr("abs:data-src"),
            image.attr("abs:src"),
            image.attr("abs:content"),
            image.attr("abs:href")
        );
        if (src == null || src.startsWith("data:")) {
            return null;
        }
        return src;
    }

    public static List<String> images(Element root, List<String> selectors) {
        Set<String> out = new LinkedHashSet<>();
        for (String selector : selectors) {
            for (Element image : root.select(selector)) {
                String src = imageSource(image);
                if (src != null) {
                    out.add(src);
                }
                if (out.size() >= MAX_IMAGES) {
                    return new ArrayList<>(out);
                }
            }
        }
        return new ArrayList<>(out);
    }

    public static String findPriceText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = PRICE_TEXT.matcher(text);
        return matcher.find() ? matcher.group().trim() : null;
    }

    public static String findSkuText(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = SKU_TEXT.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static Integer findTotalCount(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = TOTAL_COUNT.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String digits = firstNonBlank(matcher.group(1), matcher.group(2));
        if (digits == null) {
            return null;
        }
        try {
            return Integer.parseInt(digits.replaceAll("[,.]", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static List<String> breadcrumbs(Element root) {
        Elements crumbs = root.select(
            "nav.breadcrumb a, .breadcrumb a, .breadcrumbs a, .woocommerce-breadcrumb a, "
                + "[itemtype*=BreadcrumbList] [itemprop=name], nav[aria-label*=readcrumb] a"
        );
        Set<String> out = new LinkedHashSet<>();
        for (Element crumb : crumbs) {
            String text = crumb.text().trim();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return new ArrayList<>(out);
    }

    public static String absoluteLink(Element root, String baseUrl) {
        Element anchor = root.is("a[href]") ? root : root.selectFirst("a[href]");
        if (anchor == null) {
            return null;
        }
        String href = anchor.attr("abs:href");
        if (href == null || href.isBlank()) {
            return UrlNormalizer.resolve(baseUrl, anchor.attr("href"));
        }
        return UrlNormalizer.normalize(href);
    }

    public static boolean classOrIdMatches(Element element, Pattern pattern) {
        String id = element.id();
        String className = element.className();
        return (!id.isEmpty() && pattern.matcher(id.toLowerCase(Locale.ROOT)).find())
            || (!className.isEmpty() && pattern.matcher(className.toLowerCase(Locale.ROOT)).find());
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
