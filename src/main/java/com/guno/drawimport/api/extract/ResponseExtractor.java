package com.guno.drawimport.api.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.util.NumericTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Response Extractor - finds the record list inside a payload of unknown envelope shape.
 *
 * Container paths are dotted keys tried in configured order; {@code $} is the payload root.
 * No match is not an error: the caller just sees zero rows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseExtractor {

    public static final String ROOT = "$";

    private final DrawSourceProperties properties;

    public List<JsonNode> extractRows(JsonNode payload) {
        return extractRows(payload, properties.getApi().getContainerPaths());
    }

    public List<JsonNode> extractRows(JsonNode payload, List<String> containerPaths) {
        if (payload == null || containerPaths == null) return List.of();

        for (String path : containerPaths) {
            JsonNode node = resolve(payload, path);
            if (node != null && node.isArray() && !node.isEmpty()) {
                log.debug("Record list found at '{}' ({} rows)", path, node.size());
                List<JsonNode> rows = new ArrayList<>(node.size());
                node.forEach(rows::add);
                return rows;
            }
        }

        log.debug("No record list at any of {} container paths", containerPaths.size());
        return List.of();
    }

    /**
     * First integer found at the configured total-count paths.
     */
    public Optional<Integer> totalCountHint(JsonNode payload) {
        if (payload == null) return Optional.empty();

        for (String path : properties.getApi().getTotalCountPaths()) {
            JsonNode node = resolve(payload, path);
            if (node == null || node.isNull() || node.isContainerNode()) continue;

            if (node.isIntegralNumber()) {
                if (node.canConvertToInt()) return Optional.of(node.intValue());
                log.debug("Total count hint at '{}' does not fit an int: {}", path, node.asText());
                continue;
            }
            if (node.isTextual() && NumericTokens.isAllDigits(node.asText().trim())) {
                try {
                    return Optional.of(Integer.parseInt(node.asText().trim()));
                } catch (NumberFormatException e) {
                    log.debug("Total count hint at '{}' is not an int: {}", path, node.asText());
                }
            }
        }
        return Optional.empty();
    }

    static JsonNode resolve(JsonNode root, String path) {
        if (path == null || path.isBlank()) return null;
        if (ROOT.equals(path.trim())) return root;

        JsonNode current = root;
        for (String key : path.trim().split("\\.")) {
            if (current == null || !current.isObject()) return null;
            current = current.get(key);
        }
        return current;
    }
}
