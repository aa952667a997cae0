package com.docingest.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document body into overlapping spans of at most {@code maxChunkSize} characters.
 *
 * <p>A span ends at the last paragraph break inside the window, else the last line break, else the last
 * sentence end, else the last whitespace; only when none of these exist is the window cut hard. The next
 * span starts up to {@code overlapSize} characters before the previous end, moved forward to a word start
 * when one exists inside the overlap. Offsets are kept on every span so the body can be rebuilt exactly.
 *
 * <p>No span starts or ends between the two halves of a surrogate pair. Spans holding only whitespace are
 * dropped and the remaining spans are indexed consecutively.
 */
public class Chunker {
    private static final int PARAGRAPH = 0;
    private static final int LINE = 1;
    private static final int SENTENCE = 2;
    private static final int WORD = 3;

    private final int maxChunkSize;
    private final int overlapSize;

    public Chunker(ChunkingPolicy policy) {
        this.maxChunkSize = policy.maxChunkSize();
        this.overlapSize = policy.overlapSize();
    }

    public Chunker(int maxChunkSize, int overlapSize) {
        this(new ChunkingPolicy(maxChunkSize, overlapSize));
    }

    public List<TextChunk> chunk(String text) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        int length = text.length();
        int start = 0;
        int chunkIndex = 0;
        while (start < length) {
            int end = length - start <= maxChunkSize
                    ? length
                    : breakPosition(text, start);
            String content = text.substring(start, end);
            if (!content.isBlank()) {
                chunks.add(new TextChunk(chunkIndex++, content, start, end));
            }
            if (end == length) {
                break;
            }
            start = nextStart(text, start, end);
        }
        return chunks;
    }

    private int breakPosition(String text, int start) {
        int limit = start + maxChunkSize;
        // ending at or before start + overlap would stall the next span
        int floor = start + overlapSize;
        for (int level = PARAGRAPH; level <= WORD; level++) {
            for (int end = limit; end > floor; end--) {
                if (isBoundary(text, end, level)) {
                    return end;
                }
            }
        }
        return splitsSurrogatePair(text, limit) && limit - 1 > start ? limit - 1 : limit;
    }

    private int nextStart(String text, int start, int end) {
        int candidate = Math.max(end - overlapSize, start + 1);
        for (int position = candidate; position < end; position++) {
            if (isWordStart(text, position)) {
                return position;
            }
        }
        return splitsSurrogatePair(text, candidate) ? candidate + 1 : candidate;
    }

    private static boolean splitsSurrogatePair(String text, int position) {
        return position > 0
                && position < text.length()
                && Character.isLowSurrogate(text.charAt(position))
                && Character.isHighSurrogate(text.charAt(position - 1));
    }

    private static boolean isBoundary(String text, int end, int level) {
        char last = text.charAt(end - 1);
        return switch (level) {
            case PARAGRAPH -> last == '\n' && end >= 2 && text.charAt(end - 2) == '\n';
            case LINE -> last == '\n';
            case SENTENCE -> Character.isWhitespace(last) && end >= 2 && isSentenceEnd(text.charAt(end - 2));
            default -> Character.isWhitespace(last);
        };
    }

    private static boolean isSentenceEnd(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static boolean isWordStart(String text, int position) {
        return !Character.isWhitespace(text.charAt(position))
                && Character.isWhitespace(text.charAt(position - 1));
    }
}
