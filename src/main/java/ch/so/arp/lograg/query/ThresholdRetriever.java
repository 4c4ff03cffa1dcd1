package ch.so.arp.lograg.query;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.lograg.ai.EmbeddingProvider;
import ch.so.arp.lograg.store.VectorStore;

/**
 * Similarity search over one collection that drops every hit scoring below a
 * threshold. An empty result is a regular outcome meaning that no passage is
 * relevant enough.
 */
public class ThresholdRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdRetriever.class);

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final String collection;

    public ThresholdRetriever(VectorStore vectorStore, EmbeddingProvider embeddingProvider, String collection) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    /**
     * @param query     the question
     * @param k         maximum number of candidates, at least 1
     * @param threshold minimum cosine similarity, between -1 and 1
     * @return the passages scoring at least {@code threshold}, best first
     */
    public List<ScoredChunk> retrieve(String query, int k, double threshold) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, was " + k);
        }
        if (Double.isNaN(threshold) || threshold < -1.0d || threshold > 1.0d) {
            throw new IllegalArgumentException("threshold must be between -1 and 1, was " + threshold);
        }
        float[] embedding = embeddingProvider.embed(query);
        List<ScoredChunk> candidates = vectorStore.similaritySearch(collection, embedding, k).stream()
                .map(ScoredChunk::of)
                .toList();
        List<ScoredChunk> relevant = candidates.stream()
                .filter(candidate -> candidate.score() >= threshold)
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .toList();
        LOGGER.debug("{} of {} candidates from '{}' reached threshold {}", relevant.size(), candidates.size(),
                collection, threshold);
        return relevant;
    }

    public String collection() {
        return collection;
    }
}
