package com.docingest.ingest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

class InMemoryChunkRecordStore implements ChunkRecordStore {
    private final Map<String, ChunkRecord> rows = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> events;
    private final AtomicInteger createCalls = new AtomicInteger();
    private volatile Function<ChunkRecord, RuntimeException> failure = record -> null;

    InMemoryChunkRecordStore() {
        this(Collections.synchronizedList(new ArrayList<>()));
    }

    InMemoryChunkRecordStore(List<String> events) {
        this.events = events;
    }

    void failWhen(Function<ChunkRecord, RuntimeException> failure) {
        this.failure = failure;
    }

    @Override
    public ChunkRecord create(ChunkRecord record) {
        createCalls.incrementAndGet();
        RuntimeException error = failure.apply(record);
        if (error != null) {
            throw error;
        }
        ChunkRecord stored = record.withCreatedAt(Instant.now());
        synchronized (rows) {
            if (rows.containsKey(record.id())) {
                throw ExternalCallException.permanent("chunk-store", "duplicate id " + record.id(), null);
            }
            rows.put(record.id(), stored);
        }
        events.add("row:" + record.id());
        return stored;
    }

    @Override
    public Optional<ChunkRecord> findById(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<ChunkRecord> findByDocumentId(String documentId) {
        synchronized (rows) {
            return rows.values().stream()
                    .filter(row -> row.documentId().equals(documentId))
                    .sorted(Comparator.comparing(ChunkRecord::createdAt).thenComparingInt(ChunkRecord::chunkIndex))
                    .toList();
        }
    }

    int size() {
        return rows.size();
    }

    int createCalls() {
        return createCalls.get();
    }
}
