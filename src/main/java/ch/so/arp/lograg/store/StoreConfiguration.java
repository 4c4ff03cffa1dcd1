package ch.so.arp.lograg.store;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Chooses the vector store. {@code lograg.mock-vector-store=false} switches
 * from the in-memory store to PostgreSQL with pgvector.
 */
@Configuration
public class StoreConfiguration {

    @Bean
    @ConditionalOnProperty(name = "lograg.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorStore inMemoryVectorStore() {
        return new InMemoryVectorStore();
    }

    @Bean
    @ConditionalOnProperty(name = "lograg.mock-vector-store", havingValue = "false")
    public VectorStore postgresVectorStore(JdbcClient jdbcClient, ObjectProvider<ObjectMapper> objectMapper) {
        return new PostgresVectorStore(jdbcClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
