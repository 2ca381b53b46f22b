package com.delta.catalogcrawler.crawl.extract;

import com.delta.catalogcrawler.crawl.model.Platform;
import com.delta.catalogcrawler.crawl.model.RawVariant;
import com.delta.catalogcrawler.crawl.model.SpecEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variant and specification markup found on product detail pages.
 */
@Component
public class ProductDetailsExtractor {
    private static final Logger log = LoggerFactory.getLogger(ProductDetailsExtractor.class);

    private static final String SPEC_TABLES =
        ".specifications table, .product-specs table, .specs table, #specifications table, #tab-additional_information table, "
            + "table.woocommerce-product-attributes, .product-attributes table, table.data-table.additional-attributes";
    private static final String SPEC_LISTS = "dl.specs, .specifications dl, .product-specs dl, dl.product-attributes";
    private static final String FEATURE_ITEMS = ".product-features li, .features li, .product-details li";

    private final ObjectMapper objectMapper;

    public ProductDetailsExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RawVariant> extractVariants(Document document, Platform platform) {
        List<RawVariant> variants = new ArrayList<>();
        if (platform == Platform.WOOCOMMERCE || document.selectFirst("form.variations_form[data-product_variations]") != null) {
            variants.addAll(wooCommerceVariants(document));
        }
        if (variants.isEmpty()) {
            variants.addAll(dataAttributeVariants(document));
        }
        if (variants.isEmpty()) {
            variants.addAll(selectOptionVariants(document));
        }
        return variants;
    }

    public List<SpecEntry> extractSpecs(Document document) {
        List<SpecEntry> specs = new ArrayList<>();
        for (Element table : document.select(SPEC_TABLES)) {
            for (Element row : table.select("tr")) {
                addRow(row, specs);
            }
        }
        for (Element list : document.select(SPEC_LISTS)) {
            for (Element term : list.select("dt")) {
                Element definition = term.nextElementSibling();
                if (definition != null && definition.is("dd")) {
                    specs.add(new SpecEntry(term.text(), definition.text()));
                }
            }
        }
        for (Element item : document.select(FEATURE_ITEMS)) {
            String text = item.text();
            int colon = text.indexOf(':');
            if (colon > 0 && colon < text.length() - 1) {
                specs.add(new SpecEntry(text.substring(0, colon), text.substring(colon + 1)));
            }
        }
        return specs;
    }

    public List<String> extractGalleryImages(Document document) {
        return DomSupport.images(document, List.of(
            ".woocommerce-product-gallery__image a",
            ".woocommerce-product-gallery img",
            ".product-gallery img",
            ".product__media img",
            ".fotorama__img",
            ".productView-image img"
        ));
    }

    private void addRow(Element row, List<SpecEntry> specs) {
        Element key = row.selectFirst("th");
        Element value = row.selectFirst("td");
        if (key == null) {
            if (row.select("td").size() < 2) {
                return;
            }
            key = row.select("td").get(0);
            value = row.select("td").get(1);
        }
        if (value != null && !key.text().isBlank()) {
            specs.add(new SpecEntry(key.text(), value.text()));
        }
    }

    private List<RawVariant> wooCommerceVariants(Document document) {
        List<RawVariant> out = new ArrayList<>();
        Element form = document.selectFirst("form.variations_form[data-product_variations]");
        if (form == null) {
            return out;
        }
        String payload = form.attr("data-product_variations");
        if (payload.isBlank() || "false".equals(payload)) {
            return out;
        }
        try {
            JsonNode variations = objectMapper.readTree(payload);
            if (!variations.isArray()) {
                return out;
            }
            for (JsonNode variation : variations) {
                Map<String, String> attributes = new LinkedHashMap<>();
                JsonNode attributeNode = variation.path("attributes");
                attributeNode.fields().forEachRemaining(entry -> attributes.put(
                    entry.getKey().replaceFirst("^attribute_", "").replaceFirst("^pa_", ""),
                    entry.getValue().asText()
                ));
                String price = variation.hasNonNull("display_price") ? variation.get("display_price").asText() : null;
                String availability = variation.has("is_in_stock")
                    ? (variation.get("is_in_stock").asBoolean() ? "in stock" : "out of stock")
                    : null;
                out.add(new RawVariant(JsonLdReader.text(variation, "sku"), price, availability, attributes));
            }
        } catch (JsonProcessingException e) {
            log.debug("Unparseable WooCommerce variation payload: {}", e.getOriginalMessage());
        }
        return out;
    }

    private List<RawVariant> dataAttributeVariants(Document document) {
        List<RawVariant> out = new ArrayList<>();
        for (Element element : document.select("[data-variant-id]")) {
            Map<String, String> attributes = new LinkedHashMap<>();
            String title = DomSupport.firstNonBlank(element.attr("data-variant-title"), element.attr("title"), element.text());
            if (title != null) {
                attributes.put("option", title.trim());
            }
            out.add(new RawVariant(
                DomSupport.firstNonBlank(element.attr("data-sku"), element.attr("data-variant-sku")),
                DomSupport.firstNonBlank(element.attr("data-price"), element.attr("data-variant-price")),
                DomSupport.firstNonBlank(element.attr("data-availability"), element.hasAttr("disabled") ? "unavailable" : null),
                attributes
            ));
        }
        return out;
    }

    private List<RawVariant> selectOptionVariants(Document document) {
        List<RawVariant> out = new ArrayList<>();
        for (Element select : document.select(".variations select, select[name^=attribute], select[name=id], select.product-variant")) {
            String attributeName = DomSupport.firstNonBlank(
                select.attr("data-attribute_name").replaceFirst("^attribute_", "").replaceFirst("^pa_", ""),
                select.attr("name").replaceFirst("^attribute_", "").replaceFirst("^pa_", ""),
                "option"
            );
            for (Element option : select.select("option")) {
                String value = option.attr("value");
                String label = option.text().trim();
                if (value.isBlank() || label.isEmpty() || label.toLowerCase().startsWith("choose")) {
                    continue;
                }
                String price = DomSupport.firstNonBlank(option.attr("data-price"), DomSupport.findPriceText(label));
                String optionLabel = label.contains(" - ") ? label.substring(0, label.indexOf(" - ")).trim() : label;
                out.add(new RawVariant(
                    DomSupport.firstNonBlank(option.attr("data-sku")),
                    price,
                    option.hasAttr("disabled") ? "unavailable" : null,
                    Map.of(attributeName, optionLabel)
                ));
            }
        }
        return out;
    }
}
