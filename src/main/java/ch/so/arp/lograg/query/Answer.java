package ch.so.arp.lograg.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Generated answer and the passages it is grounded on. The citations are empty
 * exactly when the answer is the refusal.
 */
public record Answer(String text, List<ScoredChunk> citations) {

    public static final String REFUSAL = "Sorry, the question is out of my scope";

    public Answer {
        citations = List.copyOf(citations);
        if (citations.isEmpty() && !REFUSAL.equals(text)) {
            throw new IllegalArgumentException("An answer without citations must be the refusal");
        }
    }

    public static Answer refusal() {
        return new Answer(REFUSAL, List.of());
    }

    @JsonIgnore
    public boolean isRefusal() {
        return citations.isEmpty();
    }
}
