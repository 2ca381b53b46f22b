package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.PaginationHint;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds "next page" links and "load more" triggers on listing pages.
 */
@Component
public class PaginationDetector {
    private static final List<String> NEXT_SELECTORS = List.of(
        "link[rel=next]",
        "a[rel=next]",
        "a.next.page-numbers",
        ".woocommerce-pagination a.next",
        "a.pagination__next",
        "li.pages-item-next a",
        ".pagination-item--next a",
        "a.next",
        ".pagination .next a",
        ".pagination a[aria-label*=Next]",
        ".pager a[title*=Next]",
        "a[aria-label=Next page]"
    );
    private static final List<String> LOAD_MORE_SELECTORS = List.of(
        "button.load-more",
        "a.load-more",
        "[data-load-more]",
        "button[class*=load-more]",
        "a[class*=load-more]",
        "[data-action=load-more]"
    );
    private static final Pattern NEXT_TEXT = Pattern.compile("^(?:next|next page|›|»|>|→|weiter|suivant|siguiente)$");
    private static final Pattern PAGE_OF = Pattern.compile("(?i)page\\s+(\\d+)\\s+of\\s+(\\d+)");
    private static final Pattern PAGE_PARAM = Pattern.compile("(?i)(?:[?&](?:page|p|pg)=|/page/)(\\d+)");

    public PaginationHint detect(Document document, String currentUrl) {
        if (document == null) {
            return PaginationHint.none();
        }
        String normalizedCurrent = UrlNormalizer.normalize(currentUrl);
        String nextUrl = findNextUrl(document, currentUrl, normalizedCurrent);
        boolean loadMore = nextUrl == null && hasLoadMore(document);
        if (loadMore) {
            nextUrl = loadMoreTarget(document, currentUrl, normalizedCurrent);
        }
        PageNumbers pages = pageNumbers(document, currentUrl);
        return new PaginationHint(nextUrl, loadMore, pages.current(), pages.total());
    }

    private String findNextUrl(Document document, String currentUrl, String normalizedCurrent) {
        for (String selector : NEXT_SELECTORS) {
            for (Element element : document.select(selector)) {
                String candidate = linkTarget(element, currentUrl);
                if (usable(candidate, normalizedCurrent)) {
                    return candidate;
                }
            }
        }
        for (Element anchor : document.select("a[href]")) {
            String text = anchor.text().trim().toLowerCase(Locale.ROOT);
            if (NEXT_TEXT.matcher(text).matches()) {
                String candidate = linkTarget(anchor, currentUrl);
                if (usable(candidate, normalizedCurrent)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private boolean hasLoadMore(Document document) {
        for (String selector : LOAD_MORE_SELECTORS) {
            if (document.selectFirst(selector) != null) {
                return true;
            }
        }
        for (Element button : document.select("button, a")) {
            String text = button.text().trim().toLowerCase(Locale.ROOT);
            if (text.equals("load more") || text.equals("show more") || text.equals("load more products")) {
                return true;
            }
        }
        return false;
    }

    private String loadMoreTarget(Document document, String currentUrl, String normalizedCurrent) {
        for (String selector : LOAD_MORE_SELECTORS) {
            for (Element element : document.select(selector)) {
                String href = DomSupport.firstNonBlank(element.attr("data-next-url"), element.attr("data-url"), element.attr("href"));
                if (href == null || href.startsWith("#") || href.startsWith("javascript:")) {
                    continue;
                }
                String candidate = UrlNormalizer.resolve(currentUrl, href);
                if (usable(candidate, normalizedCurrent)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private String linkTarget(Element element, String currentUrl) {
        String href = element.attr("href");
        if (href.isBlank() || href.startsWith("#") || href.startsWith("javascript:")) {
            return null;
        }
        return UrlNormalizer.resolve(currentUrl, href);
    }

    private boolean usable(String candidate, String normalizedCurrent) {
        return candidate != null && !Objects.equals(candidate, normalizedCurrent);
    }

    private PageNumbers pageNumbers(Document document, String currentUrl) {
        Integer current = null;
        Integer total = null;
        Matcher pageOf = PAGE_OF.matcher(document.select(".pagination, .pager, .page-numbers, nav").text());
        if (pageOf.find()) {
            current = Integer.parseInt(pageOf.group(1));
            total = Integer.parseInt(pageOf.group(2));
        }
        if (current == null) {
            Element active = document.selectFirst(
                ".page-numbers.current, .pagination .active, .pagination [aria-current=page], li.pages-item.current strong"
            );
            if (active != null) {
                current = parseInt(active.text());
            }
        }
        if (current == null && currentUrl != null) {
            Matcher param = PAGE_PARAM.matcher(currentUrl);
            if (param.find()) {
                current = parseInt(param.group(1));
            }
        }
        if (total == null) {
            for (Element number : document.select(".page-numbers a, .pagination a, .pagination li")) {
                Integer value = parseInt(number.text());
                if (value != null && (total == null || value > total)) {
                    total = value;
                }
            }
        }
        if (current == null && total != null) {
            current = 1;
        }
        return new PageNumbers(current, total);
    }

    private Integer parseInt(String text) {
        String digits = text == null ? "" : text.replaceAll("[^0-9]", "");
        if (digits.isEmpty() || digits.length() > 6) {
            return null;
        }
        return Integer.parseInt(digits);
    }

    private record PageNumbers(Integer current, Integer total) {
    }
}
