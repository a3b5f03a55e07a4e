package ch.so.arp.pdfrag.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Splits text into overlapping chunks of at most {@code maxChunkSize} characters.
 * A chunk preferably ends after a paragraph break, then after a line break, a
 * sentence or a word. Only if none of these is found in the second half of the
 * window the text is cut hard. Each following chunk starts exactly
 * {@code overlap} characters before the end of its predecessor, so dropping
 * those characters and concatenating the chunks yields the original text.
 */
public class TextChunker {

    private final int maxChunkSize;
    private final int overlap;

    public TextChunker(int maxChunkSize, int overlap) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        if (overlap < 0 || overlap >= maxChunkSize) {
            throw new IllegalArgumentException("overlap must be between 0 and maxChunkSize - 1");
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
    }

    public List<TextChunk> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<TextChunk> chunks = new ArrayList<>();
        int start = 0;
        int shared = 0;
        while (true) {
            int end = start + maxChunkSize >= text.length() ? text.length() : findEnd(text, start);
            chunks.add(new TextChunk(chunks.size(), text.substring(start, end), start, end, shared));
            if (end == text.length()) {
                return List.copyOf(chunks);
            }
            start = end - overlap;
            shared = overlap;
        }
    }

    private int findEnd(String text, int start) {
        int windowEnd = start + maxChunkSize;
        int minEnd = start + Math.max(overlap + 1, maxChunkSize / 2);
        List<IntPredicate> boundaries = List.of(
                end -> text.charAt(end - 1) == '\n' && end - 2 >= start && text.charAt(end - 2) == '\n',
                end -> text.charAt(end - 1) == '\n',
                end -> Character.isWhitespace(text.charAt(end - 1)) && end - 2 >= start
                        && ".!?".indexOf(text.charAt(end - 2)) >= 0,
                end -> Character.isWhitespace(text.charAt(end - 1)));
        for (IntPredicate boundary : boundaries) {
            for (int end = windowEnd; end >= minEnd; end--) {
                if (boundary.test(end)) {
                    return end;
                }
            }
        }
        return windowEnd;
    }
}
