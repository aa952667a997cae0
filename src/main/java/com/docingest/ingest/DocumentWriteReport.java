package com.docingest.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one document's dual write. Chunks after the first failure are never attempted and have no
 * outcome; persisted chunks stay persisted even when the document failed.
 */
public record DocumentWriteReport(String documentId, int totalChunks, List<ChunkOutcome> outcomes) {
    public DocumentWriteReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean success() {
        return outcomes.size() == totalChunks && outcomes.stream().allMatch(ChunkOutcome::isPersisted);
    }

    public List<ChunkRecord> persistedRecords() {
        return outcomes.stream()
                .filter(ChunkOutcome::isPersisted)
                .map(ChunkOutcome::record)
                .toList();
    }

    public int persistedCount() {
        return persistedRecords().size();
    }

    public Optional<ChunkOutcome> firstFailure() {
        return outcomes.stream().filter(outcome -> !outcome.isPersisted()).findFirst();
    }
}
