package ch.so.arp.lograg.query;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.lograg.store.VectorStore;

/**
 * Request/response entry point for questions. Fills in configured defaults,
 * makes sure the collection has been ingested and logs each exchange.
 */
public class QueryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryService.class);

    private final GroundedAnswerComposer composer;
    private final VectorStore vectorStore;
    private final QueryProperties properties;

    public QueryService(GroundedAnswerComposer composer, VectorStore vectorStore, QueryProperties properties) {
        this.composer = Objects.requireNonNull(composer, "composer");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * @param question  the question
     * @param k         candidate count, {@code null} for the default
     * @param threshold minimum score, {@code null} for the default
     * @param history   earlier turns, may be {@code null}
     * @throws CollectionNotReadyException if nothing has been ingested yet
     */
    public Answer ask(String question, Integer k, Double threshold, List<ConversationTurn> history) {
        ensureReady(properties.getCollection());
        int effectiveK = k != null ? k : properties.getDefaultK();
        double effectiveThreshold = threshold != null ? threshold : properties.getDefaultThreshold();

        LOGGER.info("Querying logs with: {} (k={}, threshold={})", question, effectiveK, effectiveThreshold);
        Answer answer = composer.answer(question, effectiveK, effectiveThreshold,
                history == null ? List.of() : history);
        LOGGER.info("Answer: {}", answer.text());
        answer.citations().forEach(citation -> LOGGER.info("Source document: {} (score {})", citation.source(),
                String.format("%.3f", citation.score())));
        return answer;
    }

    private void ensureReady(String collection) {
        if (!vectorStore.collectionExists(collection)) {
            throw new CollectionNotReadyException(
                    "Collection '" + collection + "' does not exist. Run ingestion first");
        }
        if (vectorStore.pointCount(collection) == 0) {
            throw new CollectionNotReadyException("Collection '" + collection + "' is empty. Run ingestion first");
        }
    }
}
