package com.docingest.ingest;

import java.util.Map;

public record VectorRecord(String id, float[] values, Map<String, Object> metadata) {
    public VectorRecord {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
