package com.docingest.ingest;

public interface EmbeddingService {
    /**
     * Returns a vector of {@link #dimension()} values for {@code text}.
     *
     * @throws ExternalCallException when the backing model cannot produce one; see
     *         {@link ExternalCallException#isTransient()} for retry eligibility
     */
    float[] embed(String text);

    int dimension();

    default String version() {
        return "unversioned";
    }
}
