package com.docingest;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docingest.ingest.FileIngestionRequest;
import com.docingest.ingest.IngestionResult;
import com.docingest.ingest.MetadataParser;
import com.docingest.ingest.ParsedMetadata;
import com.docingest.ingest.TextIngestionRequest;
import com.docingest.runtime.AppConfig;
import com.docingest.runtime.IngestionRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "doc-ingest",
        mixinStandardHelpOptions = true,
        version = "doc-ingest 0.1.0",
        description = "Chunks a document, embeds every chunk and stores it in the vector index and the chunk table.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_UNAVAILABLE = 3;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Ingestion kind: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--id", description = "Document id for text mode")
    String documentId;

    @Option(names = "--text", description = "Text body for text mode")
    String text;

    @Option(names = "--text-file", description = "UTF-8 file holding the text body for text mode")
    Path textFile;

    @Option(names = "--file", description = "Document to upload in file mode (.pdf, .txt, .md)")
    Path file;

    @Option(names = "--metadata", description = "JSON object merged into every chunk's metadata")
    String metadataJson;

    private final ObjectMapper jsonMapper = JsonMapper.builder().findAndAddModules().build();

    enum Mode {
        text,
        file
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath);
        log.info("Starting doc-ingest in {} mode with config {}", mode, configPath);

        try (IngestionRuntime runtime = IngestionRuntime.create(config)) {
            IngestionResult result = mode == Mode.text
                    ? ingestText(runtime)
                    : ingestFile(runtime);
            print(result);
            return exitCode(result);
        }
    }

    private IngestionResult ingestText(IngestionRuntime runtime) throws IOException {
        String body = text;
        if (body == null && textFile != null) {
            body = Files.readString(textFile, StandardCharsets.UTF_8);
        }
        ParsedMetadata metadata = new MetadataParser().parse(metadataJson);
        if (metadata.isFallback()) {
            return IngestionResult.invalid(metadata.error());
        }
        return runtime.textIngestion().ingestText(
                new TextIngestionRequest(body, documentId, metadata.values()),
                runtime.vectorIndex(),
                runtime.chunkStore());
    }

    private IngestionResult ingestFile(IngestionRuntime runtime) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            return IngestionResult.invalid("No file uploaded");
        }
        byte[] bytes = Files.readAllBytes(file);
        return runtime.fileIngestion().ingestFile(
                new FileIngestionRequest(bytes, file.getFileName().toString(), metadataJson),
                runtime.vectorIndex(),
                runtime.chunkStore());
    }

    private void print(IngestionResult result) throws IOException {
        PrintWriter out = spec == null ? new PrintWriter(System.out, true) : spec.commandLine().getOut();
        out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        out.flush();
        if (result.success()) {
            log.info("Ingested documentId={} chunks={}", result.documentId(), result.chunks());
        } else {
            log.error("Ingestion failed status={} documentId={} error={}", result.httpStatus(), result.documentId(), result.error());
        }
    }

    static int exitCode(IngestionResult result) {
        return switch (result.status()) {
            case OK -> 0;
            case INVALID_REQUEST -> EXIT_INVALID;
            case UNAVAILABLE -> EXIT_UNAVAILABLE;
            case FAILED -> EXIT_FAILED;
        };
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
