package com.docingest.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

class InMemoryVectorIndex implements VectorIndex {
    private final Map<String, VectorRecord> records = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> events;
    private final AtomicInteger upsertCalls = new AtomicInteger();
    private volatile Function<VectorRecord, RuntimeException> failure = record -> null;

    InMemoryVectorIndex() {
        this(Collections.synchronizedList(new ArrayList<>()));
    }

    InMemoryVectorIndex(List<String> events) {
        this.events = events;
    }

    void failWhen(Function<VectorRecord, RuntimeException> failure) {
        this.failure = failure;
    }

    @Override
    public void upsert(List<VectorRecord> batch) {
        upsertCalls.incrementAndGet();
        for (VectorRecord record : batch) {
            RuntimeException error = failure.apply(record);
            if (error != null) {
                throw error;
            }
        }
        for (VectorRecord record : batch) {
            records.put(record.id(), record);
            events.add("vector:" + record.id());
        }
    }

    @Override
    public Optional<VectorRecord> fetch(String id) {
        return Optional.ofNullable(records.get(id));
    }

    int size() {
        return records.size();
    }

    int upsertCalls() {
        return upsertCalls.get();
    }

    List<String> ids() {
        synchronized (records) {
            return new ArrayList<>(records.keySet());
        }
    }
}
