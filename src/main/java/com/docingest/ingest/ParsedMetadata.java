package com.docingest.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Caller metadata after parsing. When parsing failed, {@code values} is empty and {@link #failure()} says
 * why; the request carries on with the empty mapping.
 */
public record ParsedMetadata(Map<String, Object> values, String error) {
    public ParsedMetadata {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ParsedMetadata of(Map<String, Object> values) {
        return new ParsedMetadata(values, null);
    }

    public static ParsedMetadata fallback(String error) {
        return new ParsedMetadata(Map.of(), error);
    }

    public Optional<String> failure() {
        return Optional.ofNullable(error);
    }

    public boolean isFallback() {
        return error != null;
    }
}
