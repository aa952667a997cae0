package com.docingest.ingest;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class MetadataParser {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a JSON object. Blank input is an empty mapping; anything that is not a JSON object comes back as
     * a fallback carrying the reason.
     */
    public ParsedMetadata parse(String json) {
        if (json == null || json.isBlank()) {
            return ParsedMetadata.of(Map.of());
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                return ParsedMetadata.fallback("metadata must be a JSON object");
            }
            return ParsedMetadata.of(mapper.convertValue(node, new TypeReference<Map<String, Object>>() {
            }));
        } catch (JsonProcessingException e) {
            return ParsedMetadata.fallback("metadata is not valid JSON: " + e.getOriginalMessage());
        }
    }
}
