package com.docingest.ingest;

import java.util.Locale;

/**
 * Offline embedder using signed feature hashing over character trigrams. Chunks that share most of their
 * text land close together, which is enough for local runs and tests without an embedding endpoint.
 *
 * <p>The result always has unit length. Vector indexes reject all-zero vectors, so text that yields no
 * features (or whose features cancel out) maps to a fixed unit vector instead.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final int GRAM = 3;

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        double[] accumulator = new double[dimension];
        String normalized = normalize(text);
        for (int i = 0; i + GRAM <= normalized.length(); i++) {
            int hash = mix(normalized.substring(i, i + GRAM).hashCode());
            double sign = (hash & 1) == 0 ? 1.0 : -1.0;
            accumulator[Math.floorMod(hash >> 1, dimension)] += sign;
        }
        return toUnitVector(accumulator);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "trigram-hashing-" + dimension;
    }

    // lower-cased, whitespace runs collapsed, padded so first and last characters form their own grams
    private static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return " " + text.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ") + " ";
    }

    // murmur3 finalizer; String.hashCode alone clusters short grams into few buckets
    private static int mix(int hash) {
        int h = hash;
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    private float[] toUnitVector(double[] accumulator) {
        double squares = 0;
        for (double value : accumulator) {
            squares += value * value;
        }
        float[] vector = new float[dimension];
        if (squares == 0) {
            vector[0] = 1f;
            return vector;
        }
        double norm = Math.sqrt(squares);
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (accumulator[i] / norm);
        }
        return vector;
    }
}
