package com.docingest.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a document's chunks to the vector index and the relational store.
 *
 * <p>Each chunk goes through id assignment, embedding, vector upsert and row insert, strictly in that order.
 * The vector is acknowledged before its row is inserted, and the row's {@code embeddingId} repeats the
 * vector key. Nothing is rolled back: a failed chunk stops the document, earlier chunks stay persisted, and a
 * row insert failing after its upsert leaves the vector behind for reconciliation.
 *
 * <p>With {@code maxConcurrentChunks == 1} chunks run in index order on the caller's thread. Higher values
 * run up to that many chunks at once; no chunk is started after the first failure.
 */
public class DualWriteCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DualWriteCoordinator.class);

    private final EmbeddingService embeddingService;
    private final ChunkIdGenerator idGenerator;
    private final RetryPolicy retryPolicy;
    private final int maxConcurrentChunks;

    public DualWriteCoordinator(EmbeddingService embeddingService,
            ChunkIdGenerator idGenerator,
            RetryPolicy retryPolicy,
            int maxConcurrentChunks) {
        if (maxConcurrentChunks < 1) {
            throw new IllegalArgumentException("maxConcurrentChunks must be at least 1: " + maxConcurrentChunks);
        }
        this.embeddingService = embeddingService;
        this.idGenerator = idGenerator;
        this.retryPolicy = retryPolicy;
        this.maxConcurrentChunks = maxConcurrentChunks;
    }

    public DocumentWriteReport write(Document document,
            List<TextChunk> chunks,
            VectorIndex vectorIndex,
            ChunkRecordStore chunkStore,
            IngestionDeadline deadline) {
        log.info("ingest.document.start documentId={} contentType={} chunks={} concurrency={}",
                document.documentId(), document.contentType().label(), chunks.size(), maxConcurrentChunks);

        List<ChunkOutcome> outcomes = maxConcurrentChunks == 1 || chunks.size() <= 1
                ? writeSequentially(document, chunks, vectorIndex, chunkStore, deadline)
                : writeConcurrently(document, chunks, vectorIndex, chunkStore, deadline);

        DocumentWriteReport report = new DocumentWriteReport(document.documentId(), chunks.size(), outcomes);
        log.info("ingest.document.complete documentId={} success={} persisted={} attempted={} total={}",
                document.documentId(), report.success(), report.persistedCount(), outcomes.size(), chunks.size());
        return report;
    }

    private List<ChunkOutcome> writeSequentially(Document document,
            List<TextChunk> chunks,
            VectorIndex vectorIndex,
            ChunkRecordStore chunkStore,
            IngestionDeadline deadline) {
        List<ChunkOutcome> outcomes = new ArrayList<>();
        for (TextChunk chunk : chunks) {
            ChunkOutcome outcome = writeChunk(document, chunk, chunks.size(), vectorIndex, chunkStore, deadline);
            outcomes.add(outcome);
            if (!outcome.isPersisted()) {
                break;
            }
        }
        return outcomes;
    }

    private List<ChunkOutcome> writeConcurrently(Document document,
            List<TextChunk> chunks,
            VectorIndex vectorIndex,
            ChunkRecordStore chunkStore,
            IngestionDeadline deadline) {
        Queue<ChunkOutcome> accumulator = new ConcurrentLinkedQueue<>();
        AtomicBoolean aborted = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxConcurrentChunks, chunks.size()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (TextChunk chunk : chunks) {
                futures.add(executor.submit(() -> {
                    if (aborted.get()) {
                        return;
                    }
                    ChunkOutcome outcome = writeChunk(document, chunk, chunks.size(), vectorIndex, chunkStore, deadline);
                    accumulator.add(outcome);
                    if (!outcome.isPersisted()) {
                        aborted.set(true);
                    }
                }));
            }
            for (Future<?> future : futures) {
                await(future, aborted);
            }
        } finally {
            executor.shutdownNow();
        }

        List<ChunkOutcome> outcomes = new ArrayList<>(accumulator);
        outcomes.sort(Comparator.comparingInt(ChunkOutcome::index));
        return outcomes;
    }

    private void await(Future<?> future, AtomicBoolean aborted) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aborted.set(true);
            future.cancel(true);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Chunk task failed outside its error handling", e.getCause());
        }
    }

    private ChunkOutcome writeChunk(Document document,
            TextChunk chunk,
            int totalChunks,
            VectorIndex vectorIndex,
            ChunkRecordStore chunkStore,
            IngestionDeadline deadline) {
        String documentId = document.documentId();
        String chunkId = null;
        ChunkState reached = ChunkState.PENDING;
        try {
            deadline.check("chunk " + chunk.index());
            chunkId = idGenerator.makeId(document.contentType(), documentId, chunk.index());
            String key = chunkId;

            float[] vector = retryPolicy.execute("embed " + key, deadline, () -> embeddingService.embed(chunk.content()));
            reached = ChunkState.EMBEDDED;

            Map<String, Object> metadata = ChunkMetadata.build(
                    document.baseMetadata(), documentId, chunk, totalChunks, document.contentType());
            retryPolicy.execute("vector upsert " + key, deadline, () -> {
                vectorIndex.upsert(List.of(new VectorRecord(key, vector, metadata)));
                return key;
            });
            reached = ChunkState.VECTOR_STORED;

            ChunkRecord row = new ChunkRecord(key, chunk.content(), document.contentType(), metadata, documentId, key, null);
            ChunkRecord stored = retryPolicy.execute("row insert " + key, deadline, () -> chunkStore.create(row));
            log.debug("ingest.chunk.persisted documentId={} chunkIndex={} chunkId={}", documentId, chunk.index(), key);
            return ChunkOutcome.persisted(chunk.index(), stored);
        } catch (RuntimeException e) {
            boolean transientFailure = e instanceof ExternalCallException external && external.isTransient();
            log.error("ingest.chunk.failed documentId={} chunkIndex={} chunkId={} reached={} transient={} reason={}",
                    documentId, chunk.index(), chunkId, reached, transientFailure, e.getMessage(), e);
            if (reached == ChunkState.VECTOR_STORED) {
                log.warn("ingest.chunk.orphaned-vector documentId={} chunkId={}", documentId, chunkId);
            }
            return ChunkOutcome.failed(chunk.index(), chunkId, reached, e.getMessage(), transientFailure);
        }
    }
}
