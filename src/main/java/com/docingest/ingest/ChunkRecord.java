package com.docingest.ingest;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relational row for one persisted chunk. {@code id} and {@code embeddingId} both hold the key the chunk's
 * vector was upserted under.
 */
public record ChunkRecord(
        String id,
        String content,
        ContentType contentType,
        Map<String, Object> metadata,
        String documentId,
        String embeddingId,
        Instant createdAt) {
    public ChunkRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public int chunkIndex() {
        Object value = metadata.get(ChunkMetadata.CHUNK_INDEX);
        return value instanceof Number number ? number.intValue() : -1;
    }

    public ChunkRecord withCreatedAt(Instant timestamp) {
        return new ChunkRecord(id, content, contentType, metadata, documentId, embeddingId, timestamp);
    }
}
