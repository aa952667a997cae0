package com.docingest.ingest;

public record ChunkingPolicy(int maxChunkSize, int overlapSize) {
    public static final int DEFAULT_MAX_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP_SIZE = 200;

    public ChunkingPolicy {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (overlapSize < 0 || overlapSize >= maxChunkSize) {
            throw new IllegalArgumentException("overlapSize must be in [0, maxChunkSize): " + overlapSize);
        }
    }

    public static ChunkingPolicy defaults() {
        return new ChunkingPolicy(DEFAULT_MAX_CHUNK_SIZE, DEFAULT_OVERLAP_SIZE);
    }
}
