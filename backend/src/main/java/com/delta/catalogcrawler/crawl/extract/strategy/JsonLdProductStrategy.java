package com.delta.catalogcrawler.crawl.extract.strategy;

import com.delta.catalogcrawler.crawl.extract.JsonLdReader;
import com.delta.catalogcrawler.crawl.extract.PageContext;
import com.delta.catalogcrawler.crawl.model.ExtractionStrategy;
import com.delta.catalogcrawler.crawl.model.RawProduct;
import com.delta.catalogcrawler.crawl.model.RawVariant;
import com.delta.catalogcrawler.crawl.model.SpecEntry;
import com.delta.catalogcrawler.crawl.util.UrlNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.delta.catalogcrawler.crawl.extract.JsonLdReader.firstNonBlank;
import static com.delta.catalogcrawler.crawl.extract.JsonLdReader.text;

@Component
@Order(1)
public class JsonLdProductStrategy implements ProductExtractionStrategy {
    private static final List<String> VARIANT_ATTRIBUTES = List.of("color", "size", "material", "pattern");
    private static final List<String> SPEC_ATTRIBUTES = List.of("color", "material", "size", "weight", "model", "gtin13", "mpn");

    private final JsonLdReader reader;

    public JsonLdProductStrategy(JsonLdReader reader) {
        this.reader = reader;
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.JSON_LD;
    }

    @Override
    public Optional<RawProduct> extractProduct(PageContext context) {
        List<JsonNode> products = reader.findProducts(context.document());
        if (products.isEmpty()) {
            return Optional.empty();
        }
        String pageUrl = UrlNormalizer.normalize(context.url());
        JsonNode chosen = null;
        for (JsonNode node : products) {
            String nodeUrl = UrlNormalizer.resolve(context.url(), text(node, "url"));
            if (pageUrl != null && pageUrl.equals(nodeUrl)) {
                chosen = node;
                break;
            }
        }
        if (chosen == null) {
            chosen = products.get(0);
        }
        return Optional.of(toRawProduct(chosen, context.url(), true));
    }

    @Override
    public List<RawProduct> extractListing(PageContext context) {
        List<JsonNode> roots = reader.readBlocks(context.document());
        List<RawProduct> out = new ArrayList<>();
        for (JsonNode itemList : reader.collectByType(roots, Set.of("itemlist", "offercatalog"))) {
            JsonNode elements = itemList.has("itemListElement") ? itemList.get("itemListElement") : itemList.get("itemListOrder");
            if (elements == null || !elements.isArray()) {
                continue;
            }
            for (JsonNode element : elements) {
                JsonNode item = element.has("item") && element.get("item").isObject() ? element.get("item") : element;
                String itemUrl = firstNonBlank(text(item, "url"), text(element, "url"), text(element, "item"));
                RawProduct product = toRawProduct(item, itemUrl == null ? null : UrlNormalizer.resolve(context.url(), itemUrl), false);
                if (product.name() != null || product.url() != null) {
                    out.add(product);
                }
            }
        }
        if (!out.isEmpty()) {
            return out;
        }
        for (JsonNode node : reader.collectByType(roots, JsonLdReader.PRODUCT_TYPES)) {
            String nodeUrl = text(node, "url");
            out.add(toRawProduct(node, nodeUrl == null ? null : UrlNormalizer.resolve(context.url(), nodeUrl), false));
        }
        return out;
    }

    private RawProduct toRawProduct(JsonNode node, String fallbackUrl, boolean detailPage) {
        List<JsonNode> offers = offers(node.get("offers"));
        JsonNode primaryOffer = offers.isEmpty() ? null : offers.get(0);

        List<RawVariant> variants = new ArrayList<>();
        if (offers.size() > 1) {
            for (JsonNode offer : offers) {
                Map<String, String> attributes = new LinkedHashMap<>();
                String offerName = text(offer, "name");
                if (offerName != null) {
                    attributes.put("name", offerName);
                }
                variants.add(new RawVariant(text(offer, "sku"), formatPrice(offer), text(offer, "availability"), attributes));
            }
        }
        JsonNode hasVariant = node.get("hasVariant");
        if (hasVariant != null && hasVariant.isArray()) {
            for (JsonNode variant : hasVariant) {
                List<JsonNode> variantOffers = offers(variant.get("offers"));
                JsonNode variantOffer = variantOffers.isEmpty() ? null : variantOffers.get(0);
                Map<String, String> attributes = new LinkedHashMap<>();
                for (String attribute : VARIANT_ATTRIBUTES) {
                    String value = text(variant, attribute);
                    if (value != null) {
                        attributes.put(attribute, value);
                    }
                }
                if (attributes.isEmpty() && text(variant, "name") != null) {
                    attributes.put("name", text(variant, "name"));
                }
                variants.add(new RawVariant(
                    text(variant, "sku"),
                    variantOffer == null ? null : formatPrice(variantOffer),
                    variantOffer == null ? null : text(variantOffer, "availability"),
                    attributes
                ));
            }
        }

        String rawPrice = primaryOffer == null ? null : formatPrice(primaryOffer);
        String availability = primaryOffer == null ? null : text(primaryOffer, "availability");
        if (rawPrice == null && !variants.isEmpty()) {
            rawPrice = variants.get(0).rawPrice();
        }

        List<SpecEntry> specs = new ArrayList<>();
        JsonNode additional = node.get("additionalProperty");
        List<JsonNode> properties = new ArrayList<>();
        if (additional != null && additional.isArray()) {
            additional.forEach(properties::add);
        } else if (additional != null && additional.isObject()) {
            properties.add(additional);
        }
        for (JsonNode property : properties) {
            String name = text(property, "name");
            String value = text(property, "value");
            if (name != null && value != null) {
                specs.add(new SpecEntry(name, value));
            }
        }
        if (detailPage) {
            for (String attribute : SPEC_ATTRIBUTES) {
                String value = text(node, attribute);
                if (value != null) {
                    specs.add(new SpecEntry(attribute, value));
                }
            }
        }

        String url = firstNonBlank(fallbackUrl, text(node, "url"));
        return new RawProduct(
            text(node, "name"),
            rawPrice,
            availability,
            firstNonBlank(text(node, "sku"), text(node, "mpn"), text(node, "productID"), text(node, "gtin13"), text(node, "gtin")),
            url,
            text(node, "brand"),
            text(node, "description"),
            images(node.get("image")),
            variants,
            specs
        );
    }

    private List<JsonNode> offers(JsonNode offersNode) {
        List<JsonNode> out = new ArrayList<>();
        if (offersNode == null || offersNode.isNull()) {
            return out;
        }
        if (offersNode.isArray()) {
            offersNode.forEach(out::add);
            return out;
        }
        JsonNode nested = offersNode.get("offers");
        if (JsonLdReader.hasType(offersNode.get("@type"), Set.of("aggregateoffer")) && nested != null && nested.isArray()
            && offersNode.get("lowPrice") == null && offersNode.get("price") == null) {
            nested.forEach(out::add);
            return out;
        }
        out.add(offersNode);
        return out;
    }

    private String formatPrice(JsonNode offer) {
        JsonNode specification = offer.get("priceSpecification");
        if (specification != null && specification.isArray() && specification.size() > 0) {
            specification = specification.get(0);
        }
        String price = firstNonBlank(
            text(offer, "price"),
            text(offer, "lowPrice"),
            specification == null ? null : text(specification, "price")
        );
        if (price == null) {
            return null;
        }
        String currency = firstNonBlank(
            text(offer, "priceCurrency"),
            specification == null ? null : text(specification, "priceCurrency")
        );
        return currency == null ? price : price + " " + currency;
    }

    private List<String> images(JsonNode imageNode) {
        Set<String> out = new LinkedHashSet<>();
        if (imageNode == null || imageNode.isNull()) {
            return List.of();
        }
        if (imageNode.isArray()) {
            for (JsonNode child : imageNode) {
                out.addAll(images(child));
            }
        } else if (imageNode.isObject()) {
            String url = firstNonBlank(text(imageNode, "url"), text(imageNode, "contentUrl"));
            if (url != null) {
                out.add(url);
            }
        } else if (!imageNode.asText().isBlank()) {
            out.add(imageNode.asText().trim());
        }
        return new ArrayList<>(out);
    }
}
