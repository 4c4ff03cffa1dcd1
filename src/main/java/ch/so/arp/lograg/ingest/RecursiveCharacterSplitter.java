package ch.so.arp.lograg.ingest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits text into chunks of at most {@code chunkSize} characters, preferring
 * paragraph breaks, then line breaks, then spaces and finally arbitrary
 * character positions. Separators stay attached to the text before them, so
 * every chunk is an exact substring of the input. Consecutive chunks share up
 * to {@code chunkOverlap} characters made of whole pieces from the end of the
 * previous chunk.
 */
class RecursiveCharacterSplitter {

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", " ");

    private final int chunkSize;
    private final int chunkOverlap;

    RecursiveCharacterSplitter(int chunkSize, int chunkOverlap) {
        // a surrogate pair is the smallest piece that cannot be cut
        if (chunkSize < 2) {
            throw new IllegalArgumentException("chunkSize must be at least 2, was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "chunkOverlap must be between 0 and chunkSize - 1, was " + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    /**
     * @return the chunk boundaries in text order; empty for empty text
     */
    List<Span> split(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<Span> pieces = new ArrayList<>();
        collectPieces(text, 0, text.length(), 0, pieces);
        return merge(pieces);
    }

    private void collectPieces(String text, int from, int to, int level, List<Span> pieces) {
        if (to - from <= chunkSize) {
            pieces.add(new Span(from, to));
            return;
        }
        if (level == SEPARATORS.size()) {
            int position = from;
            while (position < to) {
                int next = position + Character.charCount(text.codePointAt(position));
                pieces.add(new Span(position, Math.min(next, to)));
                position = next;
            }
            return;
        }
        String separator = SEPARATORS.get(level);
        int start = from;
        int index = text.indexOf(separator, start);
        while (index >= 0 && index + separator.length() <= to) {
            int end = index + separator.length();
            collectPieces(text, start, end, level + 1, pieces);
            start = end;
            index = text.indexOf(separator, start);
        }
        if (start < to) {
            collectPieces(text, start, to, level + 1, pieces);
        }
    }

    private List<Span> merge(List<Span> pieces) {
        List<Span> chunks = new ArrayList<>();
        Deque<Span> window = new ArrayDeque<>();
        int windowLength = 0;
        for (Span piece : pieces) {
            if (windowLength + piece.length() > chunkSize && !window.isEmpty()) {
                chunks.add(new Span(window.peekFirst().start(), window.peekLast().end()));
                while (windowLength > chunkOverlap
                        || (windowLength > 0 && windowLength + piece.length() > chunkSize)) {
                    windowLength -= window.removeFirst().length();
                }
            }
            window.addLast(piece);
            windowLength += piece.length();
        }
        if (!window.isEmpty()) {
            chunks.add(new Span(window.peekFirst().start(), window.peekLast().end()));
        }
        return chunks;
    }

    /**
     * Half open character range {@code [start, end)}.
     */
    record Span(int start, int end) {

        int length() {
            return end - start;
        }
    }
}
