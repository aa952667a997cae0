package com.docingest.ingest;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.function.Supplier;

/**
 * Builds the id shared by a chunk's vector and its relational row:
 * {@code {contentType}-{documentId}-chunk-{index}-{suffix}}.
 *
 * <p>The suffix is eight random hex characters, so ingesting the same document twice yields a second,
 * independent set of chunks instead of overwriting the first.
 */
public class ChunkIdGenerator {
    private static final int SUFFIX_BYTES = 4;

    private final Supplier<String> suffixSource;

    public ChunkIdGenerator() {
        this(randomHexSuffix(new SecureRandom()));
    }

    ChunkIdGenerator(Supplier<String> suffixSource) {
        this.suffixSource = suffixSource;
    }

    public String makeId(ContentType contentType, String documentId, int index) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        return contentType.label() + "-" + documentId + "-chunk-" + index + "-" + suffixSource.get();
    }

    private static Supplier<String> randomHexSuffix(SecureRandom random) {
        return () -> {
            byte[] bytes = new byte[SUFFIX_BYTES];
            random.nextBytes(bytes);
            return HexFormat.of().formatHex(bytes);
        };
    }
}
