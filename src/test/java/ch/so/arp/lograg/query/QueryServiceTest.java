package ch.so.arp.lograg.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.lograg.store.DistanceMetric;
import ch.so.arp.lograg.store.InMemoryVectorStore;
import ch.so.arp.lograg.store.VectorEntry;

class QueryServiceTest {

    private GroundedAnswerComposer composer;
    private InMemoryVectorStore vectorStore;
    private QueryService queryService;

    @BeforeEach
    void setUp() {
        composer = mock(GroundedAnswerComposer.class);
        vectorStore = new InMemoryVectorStore();
        queryService = new QueryService(composer, vectorStore, new QueryProperties());
    }

    @Test
    void failsWhenCollectionIsMissing() {
        assertThatThrownBy(() -> queryService.ask("Why was api OOMKilled?", null, null, null))
                .isInstanceOf(CollectionNotReadyException.class)
                .hasMessageContaining("does not exist");
        verifyNoInteractions(composer);
    }

    @Test
    void failsWhenCollectionIsEmpty() {
        vectorStore.createCollection("aks_logs", 2, DistanceMetric.COSINE);

        assertThatThrownBy(() -> queryService.ask("Why was api OOMKilled?", null, null, null))
                .isInstanceOf(CollectionNotReadyException.class)
                .hasMessageContaining("is empty");
        verifyNoInteractions(composer);
    }

    @Test
    void appliesDefaultsForOpenParameters() {
        ingestOnePoint();
        Answer expected = new Answer("OOMKilled at 10:00 [1]",
                List.of(new ScoredChunk("/logs/day1.json", 0.9d, "Container api OOMKilled")));
        when(composer.answer(anyString(), anyInt(), anyDouble(), any())).thenReturn(expected);

        Answer answer = queryService.ask("Why was api OOMKilled?", null, null, null);

        assertThat(answer).isSameAs(expected);
        verify(composer).answer("Why was api OOMKilled?", 5, 0.4d, List.of());
    }

    @Test
    void passesExplicitParametersThrough() {
        ingestOnePoint();
        List<ConversationTurn> history = List.of(ConversationTurn.user("Which pods restarted?"),
                ConversationTurn.assistant("api"));
        when(composer.answer(anyString(), anyInt(), anyDouble(), any())).thenReturn(Answer.refusal());

        Answer answer = queryService.ask("Why?", 3, 0.75d, history);

        assertThat(answer.isRefusal()).isTrue();
        verify(composer).answer("Why?", 3, 0.75d, history);
    }

    private void ingestOnePoint() {
        vectorStore.createCollection("aks_logs", 2, DistanceMetric.COSINE);
        vectorStore.upsert("aks_logs", List.of(new VectorEntry("p-1", "Container api OOMKilled",
                Map.of("source", "/logs/day1.json"), new float[] { 1.0f, 0.0f })));
    }
}
