package com.docingest.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;

class PineconeVectorIndexTest {

    private static final String HOST = "https://docs-abc123.svc.us-east-1.pinecone.io";

    private final List<Request> requests = new ArrayList<>();

    @Test
    void shouldUpsertIntoNamespaceWithApiKey() {
        PineconeVectorIndex index = index(HttpEmbeddingServiceTest.respond(200, "{\"upsertedCount\":1}"), "kb");

        index.upsert(List.of(new VectorRecord("text-doc-chunk-0-00ff00ff", new float[] { 0.1f, 0.2f }, Map.of("sourceId", "doc"))));

        Request sent = requests.get(0);
        assertEquals("POST", sent.method());
        assertEquals("/vectors/upsert", sent.url().encodedPath());
        assertEquals("pc-key", sent.header("Api-Key"));
    }

    @Test
    void shouldTreatPartialAcknowledgementAsTransient() {
        PineconeVectorIndex index = index(HttpEmbeddingServiceTest.respond(200, "{\"upsertedCount\":0}"), "");

        ExternalCallException thrown = assertThrows(ExternalCallException.class,
                () -> index.upsert(List.of(new VectorRecord("id-1", new float[] { 1f }, Map.of()))));

        assertTrue(thrown.isTransient());
        assertEquals("pinecone", thrown.service());
    }

    @Test
    void shouldClassifyServerErrorsAsTransientAndAuthErrorsAsPermanent() {
        PineconeVectorIndex unavailable = index(HttpEmbeddingServiceTest.respond(503, "overloaded"), "");
        PineconeVectorIndex unauthorized = index(HttpEmbeddingServiceTest.respond(401, "bad key"), "");
        List<VectorRecord> batch = List.of(new VectorRecord("id-1", new float[] { 1f }, Map.of()));

        assertTrue(assertThrows(ExternalCallException.class, () -> unavailable.upsert(batch)).isTransient());
        assertFalse(assertThrows(ExternalCallException.class, () -> unauthorized.upsert(batch)).isTransient());
    }

    @Test
    void shouldFetchVectorWithMetadata() {
        PineconeVectorIndex index = index(HttpEmbeddingServiceTest.respond(200, """
                {"vectors":{"id-1":{"id":"id-1","values":[0.5,0.25],"metadata":{"chunkIndex":2,"type":"pdf"}}},"namespace":"kb"}
                """), "kb");

        Optional<VectorRecord> fetched = index.fetch("id-1");

        assertTrue(fetched.isPresent());
        assertArrayEquals(new float[] { 0.5f, 0.25f }, fetched.get().values());
        assertEquals(2, fetched.get().metadata().get("chunkIndex"));
        Request sent = requests.get(0);
        assertEquals("GET", sent.method());
        assertEquals("id-1", sent.url().queryParameter("ids"));
        assertEquals("kb", sent.url().queryParameter("namespace"));
    }

    @Test
    void shouldReturnEmptyWhenVectorIsUnknown() {
        PineconeVectorIndex index = index(HttpEmbeddingServiceTest.respond(200, "{\"vectors\":{}}"), "");

        assertTrue(index.fetch("missing").isEmpty());
    }

    @Test
    void shouldRejectInvalidHost() {
        assertThrows(IllegalArgumentException.class,
                () -> new PineconeVectorIndex(new OkHttpClient(), "not a url", "key", ""));
    }

    private PineconeVectorIndex index(Interceptor stub, String namespace) {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    requests.add(chain.request());
                    return stub.intercept(chain);
                })
                .build();
        return new PineconeVectorIndex(client, HOST, "pc-key", namespace);
    }
}
