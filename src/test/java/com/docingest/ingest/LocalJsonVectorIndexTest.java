package com.docingest.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalJsonVectorIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAcknowledgedUpsertsAcrossReload() throws IOException {
        Path file = tempDir.resolve("index/vectors.json");
        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(file);

        index.upsert(List.of(new VectorRecord("text-doc-chunk-0-aa", new float[] { 0.5f, 1.5f }, Map.of("chunkIndex", 0))));

        LocalJsonVectorIndex reloaded = LocalJsonVectorIndex.load(file);
        VectorRecord record = reloaded.fetch("text-doc-chunk-0-aa").orElseThrow();
        assertArrayEquals(new float[] { 0.5f, 1.5f }, record.values());
        assertEquals(0, record.metadata().get("chunkIndex"));
        assertEquals(1, reloaded.size());
        assertFalse(Files.exists(tempDir.resolve("index/vectors.json.tmp")));
    }

    @Test
    void shouldReplaceVectorWithSameId() throws IOException {
        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(tempDir.resolve("vectors.json"));

        index.upsert(List.of(new VectorRecord("id-1", new float[] { 1f }, Map.of())));
        index.upsert(List.of(new VectorRecord("id-1", new float[] { 2f }, Map.of())));

        assertEquals(1, index.size());
        assertArrayEquals(new float[] { 2f }, index.fetch("id-1").orElseThrow().values());
    }

    @Test
    void shouldStartEmptyWhenFileIsMissing() throws IOException {
        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(tempDir.resolve("absent.json"));

        assertEquals(0, index.size());
        assertTrue(index.fetch("anything").isEmpty());
    }

    @Test
    void shouldNotKeepVectorWhenWriteFails() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a file where a directory is needed");
        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(blocker.resolve("vectors.json"));

        ExternalCallException thrown = assertThrows(ExternalCallException.class,
                () -> index.upsert(List.of(new VectorRecord("id-1", new float[] { 1f }, Map.of()))));

        assertFalse(thrown.isTransient());
        assertTrue(index.fetch("id-1").isEmpty());
    }
}
