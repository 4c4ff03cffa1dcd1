package ch.so.arp.lograg.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.lograg.ai.EmbeddingProvider;
import ch.so.arp.lograg.ai.KeywordEmbeddingProvider;
import ch.so.arp.lograg.store.DistanceMetric;
import ch.so.arp.lograg.store.InMemoryVectorStore;
import ch.so.arp.lograg.store.VectorEntry;

class ThresholdRetrieverTest {

    private static final String COLLECTION = "aks_logs";

    private final EmbeddingProvider embeddingProvider = new KeywordEmbeddingProvider("oomkilled", "probe", "dns");

    private ThresholdRetriever retriever;

    @BeforeEach
    void setUp() {
        InMemoryVectorStore vectorStore = new InMemoryVectorStore();
        vectorStore.createCollection(COLLECTION, embeddingProvider.dimensions(), DistanceMetric.COSINE);
        vectorStore.upsert(COLLECTION, List.of(
                entry("1", "/logs/day1.json", "Container api OOMKilled"),
                entry("2", "/logs/day1.json", "OOMKilled after liveness probe failed"),
                entry("3", "/logs/day2.json", "Readiness probe failed"),
                entry("4", "/logs/day2.json", "DNS lookup timed out")));
        retriever = new ThresholdRetriever(vectorStore, embeddingProvider, COLLECTION);
    }

    @Test
    void keepsOnlyHitsAtOrAboveThresholdBestFirst() {
        List<ScoredChunk> chunks = retriever.retrieve("Why was the pod OOMKilled?", 5, 0.4d);

        assertThat(chunks).extracting(ScoredChunk::text)
                .containsExactly("Container api OOMKilled", "OOMKilled after liveness probe failed");
        assertThat(chunks.get(0).score()).isEqualTo(1.0d);
        assertThat(chunks.get(1).score()).isBetween(0.70d, 0.71d);
        assertThat(chunks).extracting(ScoredChunk::source).containsOnly("/logs/day1.json");
    }

    @Test
    void thresholdIsInclusive() {
        assertThat(retriever.retrieve("OOMKilled", 5, 1.0d)).extracting(ScoredChunk::text)
                .containsExactly("Container api OOMKilled");
    }

    @Test
    void limitsCandidatesToK() {
        assertThat(retriever.retrieve("OOMKilled", 1, 0.0d)).hasSize(1);
        assertThat(retriever.retrieve("OOMKilled", 10, -1.0d)).hasSize(4);
    }

    @Test
    void unrelatedQuestionFindsNothing() {
        assertThat(retriever.retrieve("Which node had disk pressure?", 5, 0.4d)).isEmpty();
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> retriever.retrieve("OOMKilled", 0, 0.4d))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retriever.retrieve("OOMKilled", 5, 1.5d))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retriever.retrieve("OOMKilled", 5, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private VectorEntry entry(String id, String source, String text) {
        return new VectorEntry(id, text, Map.of("source", source), embeddingProvider.embed(text));
    }
}
