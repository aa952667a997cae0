package com.docingest.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upload entry point. Validates the upload, parses the optional metadata JSON, stages the bytes on disk
 * and hands the file to a {@link DocumentProcessor}, relaying its result.
 */
public class FileIngestionService {
    public static final String FILE_NAME = "fileName";

    private static final Logger log = LoggerFactory.getLogger(FileIngestionService.class);

    private final DocumentProcessor processor;
    private final MetadataParser metadataParser;
    private final Path uploadDir;

    public FileIngestionService(DocumentProcessor processor, MetadataParser metadataParser, Path uploadDir) {
        this.processor = processor;
        this.metadataParser = metadataParser;
        this.uploadDir = uploadDir;
    }

    public IngestionResult ingestFile(FileIngestionRequest request, VectorIndex vectorIndex, ChunkRecordStore chunkStore) {
        if (request == null || request.fileBytes() == null || request.fileBytes().length == 0) {
            return IngestionResult.invalid("No file uploaded");
        }
        if (vectorIndex == null || chunkStore == null) {
            return IngestionResult.unavailable("Database not yet initialized");
        }

        ParsedMetadata metadata = metadataParser.parse(request.metadataJson());
        metadata.failure().ifPresent(reason -> log.warn("ingest.metadata.fallback fileName={} reason={}", request.fileName(), reason));

        log.info("ingest.file.received fileName={} size={}", request.fileName(), request.fileBytes().length);

        Path saved;
        try {
            saved = save(request.fileBytes(), request.fileName());
        } catch (IOException e) {
            log.error("ingest.file.save-failed fileName={} uploadDir={}", request.fileName(), uploadDir, e);
            return IngestionResult.failed(null, e.getMessage(), "Failed to process file upload");
        }

        try {
            return processor.process(saved, vectorIndex, chunkStore, withFileName(metadata.values(), request.fileName()));
        } catch (RuntimeException e) {
            log.error("ingest.file.failed fileName={} reason={}", request.fileName(), e.getMessage(), e);
            return IngestionResult.failed(null, e.getMessage(), "Failed to process file upload");
        } finally {
            discard(saved);
        }
    }

    private static Map<String, Object> withFileName(Map<String, Object> metadata, String fileName) {
        if (fileName == null || fileName.isBlank() || metadata.containsKey(FILE_NAME)) {
            return metadata;
        }
        Map<String, Object> enriched = new LinkedHashMap<>(metadata);
        enriched.put(FILE_NAME, fileName);
        return enriched;
    }

    private Path save(byte[] bytes, String fileName) throws IOException {
        Files.createDirectories(uploadDir);
        Path target = uploadDir.resolve(UUID.randomUUID() + "-" + sanitize(fileName));
        Files.write(target, bytes);
        return target;
    }

    private void discard(Path saved) {
        try {
            Files.deleteIfExists(saved);
        } catch (IOException e) {
            log.warn("ingest.file.cleanup-failed path={}", saved, e);
        }
    }

    static String sanitize(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "upload";
        }
        String normalized = fileName.replace('\\', '/');
        String base = normalized.substring(normalized.lastIndexOf('/') + 1);
        String cleaned = base.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() || cleaned.chars().allMatch(c -> c == '.') ? "upload" : cleaned;
    }
}
