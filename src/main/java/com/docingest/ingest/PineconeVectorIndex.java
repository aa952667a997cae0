package com.docingest.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Data-plane client for a Pinecone index host ({@code https://<index>-<project>.svc.<env>.pinecone.io}).
 */
public class PineconeVectorIndex implements VectorIndex {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String SERVICE = "pinecone";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl host;
    private final String apiKey;
    private final String namespace;

    public PineconeVectorIndex(OkHttpClient httpClient, String host, String apiKey, String namespace) {
        HttpUrl parsed = HttpUrl.parse(host);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Pinecone host: " + host);
        }
        this.httpClient = httpClient;
        this.host = parsed;
        this.apiKey = apiKey;
        this.namespace = namespace == null ? "" : namespace;
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        List<Map<String, Object>> vectors = new ArrayList<>();
        for (VectorRecord record : records) {
            Map<String, Object> vector = new LinkedHashMap<>();
            vector.put("id", record.id());
            vector.put("values", record.values());
            vector.put("metadata", record.metadata());
            vectors.add(vector);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vectors", vectors);
        if (!namespace.isBlank()) {
            body.put("namespace", namespace);
        }

        Request request = authorized(new Request.Builder()
                .url(host.newBuilder().addPathSegments("vectors/upsert").build())
                .post(RequestBody.create(encode(body), JSON)));
        JsonNode ack = call(request);
        int upserted = ack.path("upsertedCount").asInt(records.size());
        if (upserted != records.size()) {
            throw ExternalCallException.transientFailure(SERVICE,
                    "acknowledged " + upserted + " of " + records.size() + " vectors", null);
        }
    }

    @Override
    public Optional<VectorRecord> fetch(String id) {
        HttpUrl.Builder url = host.newBuilder()
                .addPathSegments("vectors/fetch")
                .addQueryParameter("ids", id);
        if (!namespace.isBlank()) {
            url.addQueryParameter("namespace", namespace);
        }
        JsonNode vector = call(authorized(new Request.Builder().url(url.build()).get())).path("vectors").path(id);
        if (vector.isMissingNode() || vector.isNull()) {
            return Optional.empty();
        }
        JsonNode valuesNode = vector.path("values");
        float[] values = new float[valuesNode.size()];
        for (int i = 0; i < valuesNode.size(); i++) {
            values[i] = (float) valuesNode.get(i).asDouble();
        }
        Map<String, Object> metadata = mapper.convertValue(vector.path("metadata"), new TypeReference<Map<String, Object>>() {
        });
        return Optional.of(new VectorRecord(id, values, metadata));
    }

    private Request authorized(Request.Builder builder) {
        return builder.header("Api-Key", apiKey == null ? "" : apiKey).build();
    }

    private JsonNode call(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String content = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw ExternalCallException.forHttpStatus(SERVICE, response.code(), content);
            }
            return content.isBlank() ? mapper.createObjectNode() : mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw ExternalCallException.permanent(SERVICE, "response is not JSON", e);
        } catch (IOException e) {
            throw ExternalCallException.transientFailure(SERVICE, request.method() + " " + request.url().encodedPath() + " failed", e);
        }
    }

    private String encode(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw ExternalCallException.permanent(SERVICE, "unable to encode request", e);
        }
    }
}
