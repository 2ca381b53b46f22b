package com.delta.catalogcrawler.crawl.normalize;

import com.delta.catalogcrawler.crawl.model.Availability;
import com.delta.catalogcrawler.crawl.model.NormalizedPrice;
import com.delta.catalogcrawler.crawl.model.NormalizedProduct;
import com.delta.catalogcrawler.crawl.model.NormalizedVariant;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.RawVariant;
import com.delta.catalogcrawler.crawl.model.SpecEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw price, availability and spec text into canonical values.
 * Every method is a pure function of its input.
 */
@Component
public class ProductNormalizer {
    private static final Pattern NUMBER = Pattern.compile("\\d(?:[\\d.,']|\\s(?=\\d{3}(?!\\d)))*");
    private static final Pattern ISO_CODE = Pattern.compile(
        "(?i)(?<![a-z])(USD|GBP|EUR|CAD|AUD|JPY|CNY|INR|BRL|MXN|SEK|NOK|DKK|PLN|CZK|HUF|CHF|ZAR|NZD|SGD|HKD|KRW)(?![a-z])"
    );
    private static final Pattern KRONA = Pattern.compile("(?i)(?<![a-z])kr\\.?(?![a-z])");
    private static final Pattern VAT_EXCLUDED = Pattern.compile("(?i)(\\b(ex|excl|excluding|exclusive of)\\.?\\s*vat\\b|\\+\\s*vat\\b)");
    private static final Pattern VAT_INCLUDED = Pattern.compile("(?i)\\b(inc|incl|including|inclusive of)\\.?\\s*vat\\b");
    private static final Pattern WAS_MARKER = Pattern.compile("(?i)\\b(was|original|rrp|regular price)\\b");
    private static final Pattern NOW_MARKER = Pattern.compile("(?i)\\bnow\\b");
    private static final Pattern QUOTE_ONLY = Pattern.compile(
        "(?i)(contact (us )?for (a )?price|call for (a )?price|price on (request|application)|price upon request"
            + "|request (a )?quote|quote only|enquire( for price)?|inquire for price|\\bpoa\\b)"
    );
    private static final Pattern FREE = Pattern.compile("(?i)^\\W*free\\W*$");
    private static final Pattern ONLY_N_LEFT = Pattern.compile("only \\d+ left");

    private static final Map<String, String> MULTI_CHAR_SYMBOLS = new LinkedHashMap<>();
    private static final Map<String, String> SINGLE_SYMBOLS = new LinkedHashMap<>();

    static {
        MULTI_CHAR_SYMBOLS.put("US$", "USD");
        MULTI_CHAR_SYMBOLS.put("NZ$", "NZD");
        MULTI_CHAR_SYMBOLS.put("HK$", "HKD");
        MULTI_CHAR_SYMBOLS.put("CA$", "CAD");
        MULTI_CHAR_SYMBOLS.put("AU$", "AUD");
        MULTI_CHAR_SYMBOLS.put("R$", "BRL");
        MULTI_CHAR_SYMBOLS.put("C$", "CAD");
        MULTI_CHAR_SYMBOLS.put("A$", "AUD");
        MULTI_CHAR_SYMBOLS.put("S$", "SGD");
        MULTI_CHAR_SYMBOLS.put("zł", "PLN");
        MULTI_CHAR_SYMBOLS.put("Kč", "CZK");

        SINGLE_SYMBOLS.put("€", "EUR");
        SINGLE_SYMBOLS.put("£", "GBP");
        SINGLE_SYMBOLS.put("¥", "JPY");
        SINGLE_SYMBOLS.put("₹", "INR");
        SINGLE_SYMBOLS.put("₩", "KRW");
        SINGLE_SYMBOLS.put("$", "USD");
    }

    public NormalizedPrice normalizePrice(String raw) {
        if (raw == null || raw.isBlank()) {
            return NormalizedPrice.unknown();
        }
        String text = raw.replace('\u00a0', ' ').replace('\u202f', ' ').trim();
        String currency = detectCurrency(text);
        Boolean vatIncluded = detectVat(text);

        if (QUOTE_ONLY.matcher(text).find()) {
            return new NormalizedPrice(null, currency, true, vatIncluded);
        }
        if (FREE.matcher(text).matches()) {
            return new NormalizedPrice(BigDecimal.ZERO, currency, false, vatIncluded);
        }

        String token = selectPriceToken(text);
        if (token == null) {
            return new NormalizedPrice(null, currency, false, vatIncluded);
        }
        BigDecimal amount = parseAmount(token);
        return new NormalizedPrice(amount, currency, false, vatIncluded);
    }

    public Availability normalizeAvailability(String raw) {
        if (raw == null || raw.isBlank()) {
            return Availability.UNKNOWN;
        }
        String lower = raw.toLowerCase(Locale.ROOT).trim();
        if (lower.contains("schema.org")) {
            lower = lower.substring(lower.lastIndexOf('/') + 1);
        }
        String spaced = lower.replace('_', ' ').replace('-', ' ').replaceAll("\\s+", " ");
        String compact = spaced.replace(" ", "");

        // "unavailable" and "not in stock" contain in-stock phrases, so out-of-stock wins first.
        if (compact.contains("outofstock")
            || compact.contains("soldout")
            || compact.contains("unavailable")
            || compact.contains("notavailable")
            || compact.contains("notinstock")
            || compact.contains("nolongeravailable")
            || compact.contains("discontinued")) {
            return Availability.OUT_OF_STOCK;
        }
        if (compact.contains("preorder") || compact.contains("presale") || compact.contains("backorder")) {
            return Availability.PREORDER;
        }
        if (compact.contains("instock")
            || compact.contains("available")
            || compact.contains("readytoship")
            || compact.contains("onlineonly")
            || compact.contains("instoreonly")
            || ONLY_N_LEFT.matcher(spaced).find()) {
            return Availability.IN_STOCK;
        }
        return Availability.UNKNOWN;
    }

    public Map<String, String> normalizeSpecs(List<SpecEntry> raw) {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null || raw.isEmpty()) {
            return out;
        }
        Map<String, String> displayKeyByDedupKey = new LinkedHashMap<>();
        for (SpecEntry entry : raw) {
            if (entry == null) {
                continue;
            }
            String key = cleanSpecKey(entry.key());
            String value = collapseWhitespace(entry.value());
            if (key == null || value == null) {
                continue;
            }
            String dedupKey = key.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-.]+", "");
            if (dedupKey.isEmpty() || displayKeyByDedupKey.containsKey(dedupKey)) {
                continue;
            }
            displayKeyByDedupKey.put(dedupKey, key);
            out.put(key, value);
        }
        return out;
    }

    public Map<String, String> normalizeSpecs(Map<String, String> raw) {
        List<SpecEntry> entries = new ArrayList<>();
        if (raw != null) {
            raw.forEach((key, value) -> entries.add(new SpecEntry(key, value)));
        }
        return normalizeSpecs(entries);
    }

    public String normalizeName(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("[®™©]", "");
        cleaned = collapseWhitespace(cleaned);
        if (cleaned == null) {
            return null;
        }
        cleaned = cleaned.replaceAll("[\\s\\-–—|:]+$", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    public String normalizeSku(String raw) {
        String cleaned = collapseWhitespace(raw);
        if (cleaned == null) {
            return null;
        }
        cleaned = cleaned.replaceFirst("(?i)^(sku|item|product code|ref)\\s*[:#.]?\\s*", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    public NormalizedProduct normalize(RawProduct raw) {
        NormalizedPrice price = normalizePrice(raw.rawPrice());
        List<NormalizedVariant> variants = new ArrayList<>();
        for (RawVariant variant : raw.variants()) {
            NormalizedPrice variantPrice = normalizePrice(variant.rawPrice());
            if (variantPrice.currency() == null && price.currency() != null) {
                variantPrice = new NormalizedPrice(
                    variantPrice.amount(),
                    price.currency(),
                    variantPrice.quoteOnly(),
                    variantPrice.vatIncluded()
                );
            }
            variants.add(new NormalizedVariant(
                normalizeSku(variant.sku()),
                variantPrice,
                normalizeAvailability(variant.rawAvailability()),
                variant.attributes() == null ? Map.of() : new LinkedHashMap<>(variant.attributes())
            ));
        }
        return new NormalizedProduct(
            normalizeName(raw.name()),
            price,
            normalizeAvailability(raw.rawAvailability()),
            normalizeSku(raw.sku()),
            variants,
            normalizeSpecs(raw.specs()),
            raw.url(),
            distinctNonBlank(raw.images()),
            collapseWhitespace(raw.brand())
        );
    }

    String detectCurrency(String text) {
        Matcher code = ISO_CODE.matcher(text);
        if (code.find()) {
            return code.group(1).toUpperCase(Locale.ROOT);
        }
        for (Map.Entry<String, String> symbol : MULTI_CHAR_SYMBOLS.entrySet()) {
            if (text.contains(symbol.getKey())) {
                return symbol.getValue();
            }
        }
        if (KRONA.matcher(text).find()) {
            return "SEK";
        }
        for (Map.Entry<String, String> symbol : SINGLE_SYMBOLS.entrySet()) {
            if (text.contains(symbol.getKey())) {
                return symbol.getValue();
            }
        }
        return null;
    }

    private Boolean detectVat(String text) {
        if (VAT_EXCLUDED.matcher(text).find()) {
            return Boolean.FALSE;
        }
        if (VAT_INCLUDED.matcher(text).find()) {
            return Boolean.TRUE;
        }
        return null;
    }

    private String selectPriceToken(String text) {
        Matcher now = NOW_MARKER.matcher(text);
        if (now.find()) {
            Matcher afterNow = NUMBER.matcher(text);
            if (afterNow.find(now.end())) {
                return afterNow.group();
            }
        }
        Matcher numbers = NUMBER.matcher(text);
        String first = null;
        int previousEnd = 0;
        while (numbers.find()) {
            if (first == null) {
                first = numbers.group();
            }
            String before = text.substring(previousEnd, numbers.start());
            previousEnd = numbers.end();
            if (!WAS_MARKER.matcher(before).find()) {
                // ranges and "from X" take the lower bound, which comes first
                return numbers.group();
            }
        }
        return first;
    }

    static BigDecimal parseAmount(String token) {
        String t = token.replaceAll("[\\s']", "").replaceAll("[.,]+$", "");
        if (t.isEmpty()) {
            return null;
        }
        int lastDot = t.lastIndexOf('.');
        int lastComma = t.lastIndexOf(',');
        char decimalSeparator = 0;
        if (lastDot >= 0 && lastComma >= 0) {
            decimalSeparator = lastDot > lastComma ? '.' : ',';
        } else if (lastDot >= 0 || lastComma >= 0) {
            char separator = lastDot >= 0 ? '.' : ',';
            int index = Math.max(lastDot, lastComma);
            int occurrences = t.length() - t.replace(String.valueOf(separator), "").length();
            int digitsAfter = t.length() - index - 1;
            String integerPart = t.substring(0, index);
            boolean thousands = occurrences > 1 || (digitsAfter == 3 && !"0".equals(integerPart));
            decimalSeparator = thousands ? 0 : separator;
        }
        StringBuilder digits = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (Character.isDigit(c)) {
                digits.append(c);
            } else if (c == decimalSeparator && i == t.lastIndexOf(decimalSeparator)) {
                digits.append('.');
            }
        }
        try {
            return new BigDecimal(digits.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String cleanSpecKey(String key) {
        String cleaned = collapseWhitespace(key);
        if (cleaned == null) {
            return null;
        }
        cleaned = cleaned.replaceAll("[:\\s]+$", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    private static List<String> distinctNonBlank(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    out.add(value.trim());
                }
            }
        }
        return List.copyOf(out);
    }
}
