package ch.so.arp.lograg.query;

import ch.so.arp.lograg.store.SearchHit;

/**
 * A retrieved log passage together with its similarity to the question. Used
 * as citation of an {@link Answer}.
 */
public record ScoredChunk(String source, double score, String text) {

    static ScoredChunk of(SearchHit hit) {
        return new ScoredChunk(hit.source(), hit.score(), hit.text());
    }

    /**
     * Formats the passage for the prompt, keeping the source next to the text
     * so that the model can refer to it.
     */
    String formatForPrompt(int number) {
        return "[" + number + "] Source: " + source + "\n" + text;
    }
}
