package com.docingest.ingest;

import java.util.List;
import java.util.Optional;

public interface ChunkRecordStore {
    /**
     * Inserts one row. There is no update path; inserting an existing id fails.
     *
     * @return the row as stored
     */
    ChunkRecord create(ChunkRecord record);

    Optional<ChunkRecord> findById(String id);

    /**
     * Rows of a document from every ingestion run, oldest first and by chunk index within a run.
     */
    List<ChunkRecord> findByDocumentId(String documentId);
}
