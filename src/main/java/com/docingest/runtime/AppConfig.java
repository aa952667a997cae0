package com.docingest.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private VectorIndexConfig vectorIndex = new VectorIndexConfig();
    private DatabaseConfig database = new DatabaseConfig();
    private RetryConfig retry = new RetryConfig();
    private IngestionConfig ingestion = new IngestionConfig();

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public VectorIndexConfig getVectorIndex() {
        return vectorIndex;
    }

    public void setVectorIndex(VectorIndexConfig vectorIndex) {
        this.vectorIndex = vectorIndex == null ? new VectorIndexConfig() : vectorIndex;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database == null ? new DatabaseConfig() : database;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChunkSize = 1000;
        private int overlapSize = 200;

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getOverlapSize() {
            return overlapSize;
        }

        public void setOverlapSize(int overlapSize) {
            this.overlapSize = overlapSize;
        }
    }

    /**
     * A blank {@code url} selects the offline hashing embedder.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "openai";
        private String url = "";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private String model = "text-embedding-ada-002";
        private int dimension = 1536;
        private long timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorIndexConfig {
        private String type = "local";
        private String path = ".docingest/vector-index.json";
        private String host = "";
        private String apiKeyEnv = "PINECONE_API_KEY";
        private String namespace = "";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DatabaseConfig {
        private String jdbcUrl = "jdbc:h2:file:./.docingest/chunks";
        private String username = "sa";
        private String password = "";
        private int maximumPoolSize = 10;
        private boolean initializeSchema = true;

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long backoffMs = 250;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private long deadlineMs = 120000;
        private int maxConcurrentChunks = 1;
        private String uploadDir = ".docingest/uploads";

        public long getDeadlineMs() {
            return deadlineMs;
        }

        public void setDeadlineMs(long deadlineMs) {
            this.deadlineMs = deadlineMs;
        }

        public int getMaxConcurrentChunks() {
            return maxConcurrentChunks;
        }

        public void setMaxConcurrentChunks(int maxConcurrentChunks) {
            this.maxConcurrentChunks = maxConcurrentChunks;
        }

        public String getUploadDir() {
            return uploadDir;
        }

        public void setUploadDir(String uploadDir) {
            this.uploadDir = uploadDir;
        }
    }
}
