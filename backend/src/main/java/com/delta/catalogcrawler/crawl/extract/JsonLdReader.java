package com.delta.catalogcrawler.crawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads schema.org linked-data blocks and walks them looking for typed nodes.
 */
@Component
public class JsonLdReader {
    public static final Set<String> PRODUCT_TYPES = Set.of("product", "productgroup", "individualproduct", "productmodel");

    private final ObjectMapper objectMapper;

    public JsonLdReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JsonNode> readBlocks(Document document) {
        List<JsonNode> roots = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                roots.add(objectMapper.readTree(payload.trim()));
            } catch (JsonProcessingException ignored) {
                // Malformed blocks are common; the remaining blocks are still usable.
            }
        }
        return roots;
    }

    /**
     * Collects nodes whose {@code @type} is one of {@code types}. Matching nodes are not descended into,
     * so offers and variants nested in a product are not reported as separate products.
     */
    public List<JsonNode> collectByType(List<JsonNode> roots, Set<String> types) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode root : roots) {
            collect(root, types, out);
        }
        return out;
    }

    public List<JsonNode> findProducts(Document document) {
        return collectByType(readBlocks(document), PRODUCT_TYPES);
    }

    public boolean containsType(List<JsonNode> roots, String type) {
        return !collectByType(roots, Set.of(type.toLowerCase(Locale.ROOT))).isEmpty();
    }

    private void collect(JsonNode node, Set<String> types, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (hasType(node.get("@type"), types)) {
                out.add(node);
                return;
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collect(value, types, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collect(child, types, out);
            }
        }
    }

    public static boolean hasType(JsonNode typeNode, Set<String> types) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return types.contains(stripVocabulary(typeNode.asText()));
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && types.contains(stripVocabulary(child.asText()))) {
                    return true;
                }
            }
        }
        return false;
    }

    public static String text(JsonNode node, String field) {
        if (node == null || node.isNull() || field == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            value = value.size() == 0 ? null : value.get(0);
            if (value == null) {
                return null;
            }
        }
        if (value.isObject()) {
            return firstNonBlank(text(value, "name"), text(value, "@id"), text(value, "url"));
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String stripVocabulary(String type) {
        String lower = type.trim().toLowerCase(Locale.ROOT);
        int slash = lower.lastIndexOf('/');
        int colon = lower.lastIndexOf(':');
        int cut = Math.max(slash, colon);
        return cut >= 0 ? lower.substring(cut + 1) : lower;
    }
}
