package ch.so.arp.lograg.ingest;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.lograg.ai.EmbeddingProvider;
import ch.so.arp.lograg.store.VectorStore;

/**
 * Wires the ingestion pipeline from {@link IngestionProperties}.
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public IngestionTracker ingestionTracker(IngestionProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonFileIngestionTracker(properties.getTrackerFile(), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionListener ingestionListener() {
        return new LoggingIngestionListener();
    }

    @Bean
    public IngestionPipeline ingestionPipeline(IngestionProperties properties, IngestionTracker tracker,
            VectorStore vectorStore, EmbeddingProvider embeddingProvider, IngestionListener listener,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        LogFileReader reader = new LogFileReader(properties.getInputDirectory(), properties.getFilePattern(),
                objectMapper);
        DocumentBuilder documentBuilder = new DocumentBuilder(properties.getLogGroupSize(),
                new RecursiveCharacterSplitter(properties.getChunkSize(), properties.getChunkOverlap()), objectMapper);
        BatchedVectorWriter writer = new BatchedVectorWriter(vectorStore, embeddingProvider, Sleeper.THREAD,
                properties.getBatchSize(), properties.getBatchPacing());
        return new IngestionPipeline(reader, documentBuilder, writer, tracker, vectorStore,
                embeddingProvider.dimensions(), listener);
    }

    @Bean
    @ConditionalOnProperty(name = "lograg.ingestion.run-on-startup", havingValue = "true")
    public ApplicationRunner ingestionStartupRunner(IngestionPipeline pipeline, IngestionProperties properties) {
        return new IngestionStartupRunner(pipeline, properties.getCollection());
    }
}
