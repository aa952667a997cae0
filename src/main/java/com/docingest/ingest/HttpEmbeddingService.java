package com.docingest.ingest;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embedding endpoint client. Sends {@code {"model": ..., "input": ...}} and accepts either an OpenAI style
 * {@code data[0].embedding} body or a bare {@code embedding} array.
 */
public class HttpEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String SERVICE = "embedding";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public HttpEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        Request request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload(text), JSON))
                .build();
        if (apiKey != null && !apiKey.isBlank()) {
            request = request.newBuilder().header("Authorization", "Bearer " + apiKey).build();
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String content = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw ExternalCallException.forHttpStatus(SERVICE, response.code(), content);
            }
            return parseVector(content);
        } catch (IOException e) {
            throw ExternalCallException.transientFailure(SERVICE, "request to " + endpoint + " failed", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return provider + "-" + model;
    }

    private String payload(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (model != null && !model.isBlank()) {
            body.put("model", model);
        }
        body.put("input", text);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw ExternalCallException.permanent(SERVICE, "unable to encode request", e);
        }
    }

    private float[] parseVector(String content) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw ExternalCallException.permanent(SERVICE, "response is not JSON", e);
        }
        JsonNode vectorNode = root.path("data").path(0).path("embedding");
        if (!vectorNode.isArray()) {
            vectorNode = root.path("embedding");
        }
        if (!vectorNode.isArray()) {
            throw ExternalCallException.permanent(SERVICE, "response carries no embedding array", null);
        }
        if (vectorNode.size() != dimension) {
            throw ExternalCallException.permanent(SERVICE,
                    "expected " + dimension + " dimensions but got " + vectorNode.size(), null);
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
