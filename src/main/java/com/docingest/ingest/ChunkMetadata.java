package com.docingest.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata stored with every chunk, in the vector index and in the relational row alike. Caller supplied
 * keys come first; the pipeline keys below always win over a caller key of the same name.
 */
public final class ChunkMetadata {
    public static final String SOURCE_ID = "sourceId";
    public static final String CHUNK_INDEX = "chunkIndex";
    public static final String TOTAL_CHUNKS = "totalChunks";
    public static final String TYPE = "type";
    public static final String TEXT = "text";

    private ChunkMetadata() {
    }

    public static Map<String, Object> build(Map<String, Object> baseMetadata,
            String documentId,
            TextChunk chunk,
            int totalChunks,
            ContentType contentType) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (baseMetadata != null) {
            metadata.putAll(baseMetadata);
        }
        metadata.put(SOURCE_ID, documentId);
        metadata.put(CHUNK_INDEX, chunk.index());
        metadata.put(TOTAL_CHUNKS, totalChunks);
        metadata.put(TYPE, contentType.label());
        metadata.put(TEXT, chunk.content());
        return Collections.unmodifiableMap(metadata);
    }
}
