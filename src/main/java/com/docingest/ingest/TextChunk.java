package com.docingest.ingest;

/**
 * One span of a document body. {@code startOffset} and {@code endOffset} index into the source text, so
 * {@code content} always equals {@code source.substring(startOffset, endOffset)}.
 */
public record TextChunk(int index, String content, int startOffset, int endOffset) {
}
