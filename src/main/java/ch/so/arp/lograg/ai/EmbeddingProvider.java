package ch.so.arp.lograg.ai;

import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for log chunks and questions.
 * Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);

    /**
     * Create embeddings for several texts. The returned list has the same order
     * as the input.
     *
     * @param texts the texts to embed
     * @return one embedding per text
     */
    default List<float[]> embedAll(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    /**
     * @return the length of every vector produced by this provider
     */
    int dimensions();
}
