package com.docingest.ingest;

import java.nio.file.Path;
import java.util.Map;

/**
 * Turns a saved upload into stored chunks: extracts its text, then chunks, embeds and dual-writes it.
 */
public interface DocumentProcessor {
    IngestionResult process(Path file, VectorIndex vectorIndex, ChunkRecordStore chunkStore, Map<String, Object> metadata);
}
