package com.docingest.extract;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docingest.ingest.ChunkRecordStore;
import com.docingest.ingest.Document;
import com.docingest.ingest.DocumentProcessor;
import com.docingest.ingest.DocumentWriteReport;
import com.docingest.ingest.FileIngestionService;
import com.docingest.ingest.IngestionPipeline;
import com.docingest.ingest.IngestionResult;
import com.docingest.ingest.VectorIndex;

/**
 * Extracts text with the first extractor that supports the file, then runs the shared ingestion pipeline
 * over it. The document id comes from the {@code documentId} metadata key, else the uploaded file's name
 * without its extension.
 */
public class ExtractingDocumentProcessor implements DocumentProcessor {
    public static final String DOCUMENT_ID = "documentId";

    private static final Logger log = LoggerFactory.getLogger(ExtractingDocumentProcessor.class);

    private final List<DocumentTextExtractor> extractors;
    private final IngestionPipeline pipeline;

    public ExtractingDocumentProcessor(IngestionPipeline pipeline) {
        this(List.of(new PdfTextExtractor(), new PlainTextExtractor()), pipeline);
    }

    public ExtractingDocumentProcessor(List<DocumentTextExtractor> extractors, IngestionPipeline pipeline) {
        this.extractors = List.copyOf(extractors);
        this.pipeline = pipeline;
    }

    @Override
    public IngestionResult process(Path file, VectorIndex vectorIndex, ChunkRecordStore chunkStore, Map<String, Object> metadata) {
        Optional<DocumentTextExtractor> extractor = extractors.stream()
                .filter(candidate -> candidate.supports(file))
                .findFirst();
        if (extractor.isEmpty()) {
            return IngestionResult.invalid("Unsupported file type: " + file.getFileName());
        }

        ExtractedText extracted;
        try {
            extracted = extractor.get().extract(file).orElse(null);
        } catch (IOException e) {
            log.error("extract.failed file={} reason={}", file.getFileName(), e.getMessage(), e);
            return IngestionResult.failed(null, e.getMessage(), "Failed to extract document text");
        }
        if (extracted == null || extracted.text().isBlank()) {
            return IngestionResult.invalid("No extractable text in " + file.getFileName());
        }

        String documentId = documentId(metadata, file);
        Document document = new Document(documentId, extracted.contentType(), extracted.text(), metadata);
        DocumentWriteReport report = pipeline.ingest(document, vectorIndex, chunkStore);
        return IngestionPipeline.toResult(report, "Document");
    }

    static String documentId(Map<String, Object> metadata, Path file) {
        Object explicit = metadata.get(DOCUMENT_ID);
        if (explicit != null && !explicit.toString().isBlank()) {
            return explicit.toString();
        }
        Object uploaded = metadata.get(FileIngestionService.FILE_NAME);
        String name = uploaded != null && !uploaded.toString().isBlank()
                ? uploaded.toString()
                : file.getFileName().toString();
        name = name.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
