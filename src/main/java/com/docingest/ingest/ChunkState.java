package com.docingest.ingest;

/**
 * Per-chunk progress through the dual write: {@code PENDING -> EMBEDDED -> VECTOR_STORED -> PERSISTED},
 * or {@code FAILED} from any step.
 */
public enum ChunkState {
    PENDING,
    EMBEDDED,
    VECTOR_STORED,
    PERSISTED,
    FAILED
}
