package com.docingest.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TextIngestionService {
    private static final Logger log = LoggerFactory.getLogger(TextIngestionService.class);

    private final IngestionPipeline pipeline;

    public TextIngestionService(IngestionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public IngestionResult ingestText(TextIngestionRequest request, VectorIndex vectorIndex, ChunkRecordStore chunkStore) {
        if (request == null || request.text() == null || request.text().isBlank()
                || request.id() == null || request.id().isBlank()) {
            return IngestionResult.invalid("Text & ID required");
        }
        if (vectorIndex == null || chunkStore == null) {
            return IngestionResult.unavailable("Database not yet initialized");
        }

        Document document = new Document(request.id(), ContentType.TEXT, request.text(), request.metadata());
        try {
            DocumentWriteReport report = pipeline.ingest(document, vectorIndex, chunkStore);
            return IngestionPipeline.toResult(report, "Text");
        } catch (RuntimeException e) {
            log.error("ingest.text.failed documentId={} reason={}", request.id(), e.getMessage(), e);
            return IngestionResult.failed(request.id(), e.getMessage(), "Internal Server Error");
        }
    }
}
