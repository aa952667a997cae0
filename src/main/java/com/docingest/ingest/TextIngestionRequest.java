package com.docingest.ingest;

import java.util.Map;

public record TextIngestionRequest(String text, String id, Map<String, Object> metadata) {
    public TextIngestionRequest(String text, String id) {
        this(text, id, Map.of());
    }
}
