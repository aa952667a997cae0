package com.docingest.ingest;

/**
 * @param lastCompleted the furthest state reached before a failure; equal to {@code state} on success
 * @param record the stored row, only present when {@code state} is {@link ChunkState#PERSISTED}
 */
public record ChunkOutcome(
        int index,
        String chunkId,
        ChunkState state,
        ChunkState lastCompleted,
        String error,
        boolean transientFailure,
        ChunkRecord record) {

    static ChunkOutcome persisted(int index, ChunkRecord record) {
        return new ChunkOutcome(index, record.id(), ChunkState.PERSISTED, ChunkState.PERSISTED, null, false, record);
    }

    static ChunkOutcome failed(int index, String chunkId, ChunkState lastCompleted, String error, boolean transientFailure) {
        return new ChunkOutcome(index, chunkId, ChunkState.FAILED, lastCompleted, error, transientFailure, null);
    }

    public boolean isPersisted() {
        return state == ChunkState.PERSISTED;
    }

    /**
     * True when the vector was upserted but its relational row was never written.
     */
    public boolean leftOrphanedVector() {
        return state == ChunkState.FAILED && lastCompleted == ChunkState.VECTOR_STORED;
    }
}
