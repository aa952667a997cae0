package com.docingest.ingest;

import java.util.List;
import java.util.Optional;

/**
 * The two vector index operations the ingestion path needs. Implementations must not return from
 * {@link #upsert} before the index has acknowledged the write.
 */
public interface VectorIndex {
    void upsert(List<VectorRecord> records);

    Optional<VectorRecord> fetch(String id);
}
