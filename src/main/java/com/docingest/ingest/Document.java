package com.docingest.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A body of text submitted for ingestion. Never stored as a row of its own; {@code documentId} is only the
 * grouping key shared by its chunks.
 */
public record Document(String documentId, ContentType contentType, String sourceText, Map<String, Object> baseMetadata) {
    public Document {
        baseMetadata = baseMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(baseMetadata));
    }
}
