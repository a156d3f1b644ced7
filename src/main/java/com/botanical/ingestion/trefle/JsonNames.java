package com.botanical.ingestion.trefle;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Trefle returns some references (genus, family, synonyms) either as plain
 * strings or as objects carrying a {@code name}, depending on the endpoint.
 */
final class JsonNames {

    private JsonNames() {
    }

    static String nameOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        JsonNode name = node.path("name");
        return name.isTextual() ? name.asText() : null;
    }

    static List<String> namesOf(List<JsonNode> nodes) {
        if (nodes == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (JsonNode node : nodes) {
            String name = nameOf(node);
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return names;
    }
}
