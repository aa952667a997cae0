package com.docingest.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docingest.extract.ExtractingDocumentProcessor;

class FileIngestionServiceTest {

    @TempDir
    Path tempDir;

    private final InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
    private final InMemoryChunkRecordStore chunkStore = new InMemoryChunkRecordStore();
    private final IngestionPipeline pipeline = new IngestionPipeline(
            new Chunker(ChunkingPolicy.defaults()),
            new DualWriteCoordinator(new ScriptedEmbeddingService(), new ChunkIdGenerator(), RetryPolicy.noRetry(), 1),
            Duration.ofMinutes(1));

    @Test
    void shouldIngestTextFileAndRemoveStagedCopy() throws IOException {
        FileIngestionService service = service(new ExtractingDocumentProcessor(pipeline));

        IngestionResult result = service.ingestFile(
                new FileIngestionRequest(bytes("lorem ".repeat(400)), "notes/Quarterly Report.txt", null),
                vectorIndex,
                chunkStore);

        assertTrue(result.success(), String.valueOf(result));
        assertEquals("Document processed and split into 3 chunks", result.message());
        assertEquals("Quarterly Report", result.documentId());
        ChunkRecord row = chunkStore.findByDocumentId("Quarterly Report").get(0);
        assertEquals("notes/Quarterly Report.txt", row.metadata().get(FileIngestionService.FILE_NAME));
        assertTrue(row.id().startsWith("text-Quarterly Report-chunk-0-"));
        assertTrue(stagedFiles().isEmpty());
    }

    @Test
    void shouldCarryOnWithEmptyMetadataWhenJsonIsMalformed() throws IOException {
        FileIngestionService service = service(new ExtractingDocumentProcessor(pipeline));

        IngestionResult result = service.ingestFile(
                new FileIngestionRequest(bytes("A short note."), "note.md", "{broken"), vectorIndex, chunkStore);

        assertTrue(result.success());
        ChunkRecord row = chunkStore.findByDocumentId("note").get(0);
        assertFalse(row.metadata().containsKey("broken"));
        assertEquals("note", row.metadata().get(ChunkMetadata.SOURCE_ID));
    }

    @Test
    void shouldUseDocumentIdFromMetadata() {
        FileIngestionService service = service(new ExtractingDocumentProcessor(pipeline));

        IngestionResult result = service.ingestFile(
                new FileIngestionRequest(bytes("A short note."), "note.txt", "{\"documentId\":\"kb-17\",\"team\":\"ops\"}"),
                vectorIndex,
                chunkStore);

        assertEquals("kb-17", result.documentId());
        ChunkRecord row = chunkStore.findByDocumentId("kb-17").get(0);
        assertEquals("ops", row.metadata().get("team"));
    }

    @Test
    void shouldRejectMissingUpload() {
        FileIngestionService service = service(new ExtractingDocumentProcessor(pipeline));

        IngestionResult empty = service.ingestFile(new FileIngestionRequest(new byte[0], "a.txt", null), vectorIndex, chunkStore);
        IngestionResult none = service.ingestFile(null, vectorIndex, chunkStore);

        assertEquals(400, empty.httpStatus());
        assertEquals("No file uploaded", empty.error());
        assertEquals(400, none.httpStatus());
    }

    @Test
    void shouldReportUnavailableWhenStoresAreNotReady() {
        FileIngestionService service = service(new ExtractingDocumentProcessor(pipeline));

        IngestionResult result = service.ingestFile(
                new FileIngestionRequest(bytes("hello"), "a.txt", null), vectorIndex, null);

        assertEquals(503, result.httpStatus());
        assertEquals("Database not yet initialized", result.error());
    }

    @Test
    void shouldRejectUnsupportedFileType() throws IOException {
        FileIngestionService service = service(new ExtractingDocumentProcessor(pipeline));

        IngestionResult result = service.ingestFile(
                new FileIngestionRequest(bytes("MZ"), "setup.exe", null), vectorIndex, chunkStore);

        assertEquals(400, result.httpStatus());
        assertTrue(result.error().startsWith("Unsupported file type"));
        assertEquals(0, vectorIndex.upsertCalls());
        assertTrue(stagedFiles().isEmpty());
    }

    @Test
    void shouldTurnProcessorCrashIntoFailureAndStillCleanUp() throws IOException {
        List<Path> seen = new ArrayList<>();
        FileIngestionService service = service((file, index, store, metadata) -> {
            seen.add(file);
            throw new IllegalStateException("extractor crashed");
        });

        IngestionResult result = service.ingestFile(
                new FileIngestionRequest(bytes("hello"), "a.txt", null), vectorIndex, chunkStore);

        assertEquals(500, result.httpStatus());
        assertEquals("extractor crashed", result.error());
        assertEquals("Failed to process file upload", result.message());
        assertEquals(1, seen.size());
        assertTrue(Files.notExists(seen.get(0)));
    }

    @Test
    void shouldSanitizeUploadedNames() {
        assertEquals("report.pdf", FileIngestionService.sanitize("../../etc/report.pdf"));
        assertEquals("my_file_1_.txt", FileIngestionService.sanitize("C:\\docs\\my file(1).txt"));
        assertEquals("upload", FileIngestionService.sanitize(".."));
        assertEquals("upload", FileIngestionService.sanitize(null));
    }

    private FileIngestionService service(DocumentProcessor processor) {
        return new FileIngestionService(processor, new MetadataParser(), tempDir.resolve("uploads"));
    }

    private List<Path> stagedFiles() throws IOException {
        Path uploads = tempDir.resolve("uploads");
        if (Files.notExists(uploads)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(uploads)) {
            return files.toList();
        }
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
