package com.contentlib.ingest.pipeline.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class JsonLdParser {
    private static final Logger log = LoggerFactory.getLogger(JsonLdParser.class);

    private final ObjectMapper objectMapper;

    public JsonLdParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JsonNode> typedNodes(Document document) {
        List<JsonNode> nodes = new ArrayList<>();
        if (document == null) {
            return nodes;
        }
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collect(objectMapper.readTree(payload.trim()), nodes);
            } catch (JsonProcessingException e) {
                log.debug("skipping malformed json-ld block: {}", e.getOriginalMessage());
            }
        }
        return nodes;
    }

    public Set<String> types(List<JsonNode> nodes) {
        Set<String> types = new LinkedHashSet<>();
        for (JsonNode node : nodes) {
            types.addAll(typesOf(node));
        }
        return types;
    }

    public Set<String> typesOf(JsonNode node) {
        Set<String> types = new LinkedHashSet<>();
        JsonNode typeNode = node == null ? null : node.get("@type");
        if (typeNode == null || typeNode.isNull()) {
            return types;
        }
        if (typeNode.isTextual()) {
            types.add(normalizeType(typeNode.asText()));
        } else if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual()) {
                    types.add(normalizeType(child.asText()));
                }
            }
        }
        types.remove("");
        return types;
    }

    public static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray() && !value.isEmpty()) {
            value = value.get(0);
        }
        if (!value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private void collect(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collect(child, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (node.has("@type")) {
            out.add(node);
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isArray() || value.isObject()) {
                collect(value, out);
            }
        });
    }

    // "schema:BlogPosting" and "https://schema.org/BlogPosting" both become "blogposting"
    private String normalizeType(String raw) {
        String value = raw.trim();
        int cut = Math.max(value.lastIndexOf('/'), value.lastIndexOf(':'));
        if (cut >= 0) {
            value = value.substring(cut + 1);
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
