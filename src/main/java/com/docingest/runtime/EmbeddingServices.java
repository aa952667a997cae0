package com.docingest.runtime;

import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docingest.ingest.EmbeddingService;
import com.docingest.ingest.HashingEmbeddingService;
import com.docingest.ingest.HttpEmbeddingService;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingServices.class);

    private EmbeddingServices() {
    }

    public static EmbeddingService fromConfig(AppConfig.EmbeddingConfig config,
            OkHttpClient httpClient,
            Function<String, String> environment) {
        String endpoint = config.getUrl();
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("embedding.offline no embedding.url configured; using hashing embedder dimension={}", config.getDimension());
            return new HashingEmbeddingService(config.getDimension());
        }
        String apiKeyEnv = config.getApiKeyEnv();
        String apiKey = apiKeyEnv == null || apiKeyEnv.isBlank() ? null : environment.apply(apiKeyEnv);
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("embedding.unauthenticated env={} is not set", apiKeyEnv);
        }
        return new HttpEmbeddingService(httpClient, endpoint, config.getProvider(), config.getModel(), apiKey, config.getDimension());
    }
}
