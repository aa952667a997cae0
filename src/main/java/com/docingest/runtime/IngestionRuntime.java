package com.docingest.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docingest.extract.ExtractingDocumentProcessor;
import com.docingest.ingest.ChunkIdGenerator;
import com.docingest.ingest.Chunker;
import com.docingest.ingest.ChunkingPolicy;
import com.docingest.ingest.DualWriteCoordinator;
import com.docingest.ingest.EmbeddingService;
import com.docingest.ingest.FileIngestionService;
import com.docingest.ingest.IngestionPipeline;
import com.docingest.ingest.JdbcChunkRecordStore;
import com.docingest.ingest.LocalJsonVectorIndex;
import com.docingest.ingest.MetadataParser;
import com.docingest.ingest.PineconeVectorIndex;
import com.docingest.ingest.RetryPolicy;
import com.docingest.ingest.TextIngestionService;
import com.docingest.ingest.VectorIndex;
import com.zaxxer.hikari.HikariDataSource;

import okhttp3.OkHttpClient;

/**
 * Everything one process needs to ingest documents, built from {@link AppConfig}. Owns the HTTP client and
 * the connection pool; the ingestion services themselves hold no connections.
 */
public final class IngestionRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionRuntime.class);

    private final OkHttpClient httpClient;
    private final HikariDataSource dataSource;
    private final VectorIndex vectorIndex;
    private final JdbcChunkRecordStore chunkStore;
    private final TextIngestionService textIngestion;
    private final FileIngestionService fileIngestion;

    private IngestionRuntime(OkHttpClient httpClient,
            HikariDataSource dataSource,
            VectorIndex vectorIndex,
            JdbcChunkRecordStore chunkStore,
            TextIngestionService textIngestion,
            FileIngestionService fileIngestion) {
        this.httpClient = httpClient;
        this.dataSource = dataSource;
        this.vectorIndex = vectorIndex;
        this.chunkStore = chunkStore;
        this.textIngestion = textIngestion;
        this.fileIngestion = fileIngestion;
    }

    public static IngestionRuntime create(AppConfig config) throws IOException {
        return create(config, System::getenv);
    }

    static IngestionRuntime create(AppConfig config, Function<String, String> environment) throws IOException {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getEmbedding().getTimeoutMs()))
                .build();
        HikariDataSource dataSource = null;
        try {
            EmbeddingService embeddingService = EmbeddingServices.fromConfig(config.getEmbedding(), httpClient, environment);
            // validates chunking, retry and concurrency settings before any pool is opened
            IngestionPipeline pipeline = pipeline(config, embeddingService);
            VectorIndex vectorIndex = vectorIndex(config.getVectorIndex(), httpClient, environment);

            dataSource = dataSource(config.getDatabase());
            JdbcChunkRecordStore chunkStore = new JdbcChunkRecordStore(dataSource);
            if (config.getDatabase().isInitializeSchema()) {
                chunkStore.initializeSchema();
            }

            TextIngestionService textIngestion = new TextIngestionService(pipeline);
            FileIngestionService fileIngestion = new FileIngestionService(
                    new ExtractingDocumentProcessor(pipeline),
                    new MetadataParser(),
                    Path.of(config.getIngestion().getUploadDir()));

            log.info("runtime.ready embedder={} dimension={} vectorIndex={} jdbcUrl={} maxChunkSize={} overlap={}",
                    embeddingService.version(),
                    embeddingService.dimension(),
                    config.getVectorIndex().getType(),
                    config.getDatabase().getJdbcUrl(),
                    config.getChunking().getMaxChunkSize(),
                    config.getChunking().getOverlapSize());
            return new IngestionRuntime(httpClient, dataSource, vectorIndex, chunkStore, textIngestion, fileIngestion);
        } catch (IOException | RuntimeException e) {
            log.error("runtime.start-failed reason={}", e.getMessage());
            release(dataSource, httpClient);
            throw e;
        }
    }

    public static IngestionPipeline pipeline(AppConfig config, EmbeddingService embeddingService) {
        Chunker chunker = new Chunker(new ChunkingPolicy(
                config.getChunking().getMaxChunkSize(),
                config.getChunking().getOverlapSize()));
        RetryPolicy retryPolicy = new RetryPolicy(config.getRetry().getMaxAttempts(), config.getRetry().getBackoffMs());
        DualWriteCoordinator coordinator = new DualWriteCoordinator(
                embeddingService,
                new ChunkIdGenerator(),
                retryPolicy,
                config.getIngestion().getMaxConcurrentChunks());
        return new IngestionPipeline(chunker, coordinator, Duration.ofMillis(config.getIngestion().getDeadlineMs()));
    }

    static VectorIndex vectorIndex(AppConfig.VectorIndexConfig config,
            OkHttpClient httpClient,
            Function<String, String> environment) throws IOException {
        String type = config.getType() == null ? "local" : config.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "local" -> LocalJsonVectorIndex.load(Path.of(config.getPath()));
            case "pinecone" -> {
                if (config.getHost() == null || config.getHost().isBlank()) {
                    throw new IllegalArgumentException("vectorIndex.host is required for the pinecone index");
                }
                yield new PineconeVectorIndex(httpClient, config.getHost(), environment.apply(config.getApiKeyEnv()), config.getNamespace());
            }
            default -> throw new IllegalArgumentException("Unknown vectorIndex.type: " + config.getType());
        };
    }

    static HikariDataSource dataSource(AppConfig.DatabaseConfig config) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(config.getJdbcUrl());
        ds.setUsername(config.getUsername());
        ds.setPassword(config.getPassword());
        ds.setMaximumPoolSize(config.getMaximumPoolSize());
        ds.setPoolName("doc-ingest");
        return ds;
    }

    public VectorIndex vectorIndex() {
        return vectorIndex;
    }

    public JdbcChunkRecordStore chunkStore() {
        return chunkStore;
    }

    public TextIngestionService textIngestion() {
        return textIngestion;
    }

    public FileIngestionService fileIngestion() {
        return fileIngestion;
    }

    @Override
    public void close() {
        release(dataSource, httpClient);
    }

    private static void release(HikariDataSource dataSource, OkHttpClient httpClient) {
        if (dataSource != null) {
            dataSource.close();
        }
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
