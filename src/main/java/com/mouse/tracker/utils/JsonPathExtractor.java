package com.mouse.tracker.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Walks a dotted key path ({@code data.item.models}) through a JSON document.
 * Every segment must be a key of an object; arrays are not indexed.
 */
@Slf4j
public final class JsonPathExtractor {

    private JsonPathExtractor() {
    }

    public static Optional<JsonNode> extract(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return Optional.empty();
        }

        JsonNode current = root;
        for (String segment : path.trim().split("\\.")) {
            if (segment.isEmpty() || current == null || !current.isObject() || !current.has(segment)) {
                return Optional.empty();
            }
            current = current.get(segment);
        }

        // JSON null at the end of the path is a miss, not a payload
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * Parses {@code body} and extracts the path. Unparseable bodies are a miss.
     */
    public static Optional<JsonNode> extract(ObjectMapper mapper, String body, String path) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return extract(mapper.readTree(body), path);
        } catch (Exception e) {
            log.debug("Response body is not JSON | Path: {} | Reason: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
