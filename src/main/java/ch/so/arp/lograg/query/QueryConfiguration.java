package ch.so.arp.lograg.query;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.lograg.ai.EmbeddingProvider;
import ch.so.arp.lograg.ai.LlmClient;
import ch.so.arp.lograg.store.VectorStore;

/**
 * Wires retrieval and answer composition for the configured collection.
 */
@Configuration
@EnableConfigurationProperties(QueryProperties.class)
public class QueryConfiguration {

    @Bean
    public ThresholdRetriever thresholdRetriever(VectorStore vectorStore, EmbeddingProvider embeddingProvider,
            QueryProperties properties) {
        return new ThresholdRetriever(vectorStore, embeddingProvider, properties.getCollection());
    }

    @Bean
    public GroundedAnswerComposer groundedAnswerComposer(ThresholdRetriever retriever, LlmClient llmClient,
            QueryProperties properties) {
        return new GroundedAnswerComposer(retriever, llmClient, properties.getMaxHistory());
    }

    @Bean
    public QueryService queryService(GroundedAnswerComposer composer, VectorStore vectorStore,
            QueryProperties properties) {
        return new QueryService(composer, vectorStore, properties);
    }
}
