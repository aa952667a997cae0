package com.docingest.ingest;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The chunk-then-dual-write loop shared by text and file ingestion.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final Chunker chunker;
    private final DualWriteCoordinator coordinator;
    private final Duration deadlineBudget;
    private final Clock clock;

    public IngestionPipeline(Chunker chunker, DualWriteCoordinator coordinator, Duration deadlineBudget) {
        this(chunker, coordinator, deadlineBudget, Clock.systemUTC());
    }

    IngestionPipeline(Chunker chunker, DualWriteCoordinator coordinator, Duration deadlineBudget, Clock clock) {
        this.chunker = chunker;
        this.coordinator = coordinator;
        this.deadlineBudget = deadlineBudget;
        this.clock = clock;
    }

    public DocumentWriteReport ingest(Document document, VectorIndex vectorIndex, ChunkRecordStore chunkStore) {
        IngestionDeadline deadline = IngestionDeadline.after(deadlineBudget, clock);
        List<TextChunk> chunks = chunker.chunk(document.sourceText());
        log.info("ingest.chunked documentId={} characters={} chunks={}",
                document.documentId(), document.sourceText().length(), chunks.size());
        return coordinator.write(document, chunks, vectorIndex, chunkStore, deadline);
    }

    /**
     * Collapses a report into the caller's success-or-failure view; {@code subject} names what was split,
     * as in "Text processed and split into 3 chunks".
     */
    public static IngestionResult toResult(DocumentWriteReport report, String subject) {
        if (report.success()) {
            int count = report.persistedCount();
            return IngestionResult.ok(subject + " processed and split into " + count + " chunks", count, report.documentId());
        }
        String reason = report.firstFailure()
                .map(failure -> "chunk " + failure.index() + " of " + report.totalChunks() + " failed: " + failure.error())
                .orElse("ingestion did not complete");
        return IngestionResult.failed(report.documentId(), reason, "Internal Server Error");
    }
}
