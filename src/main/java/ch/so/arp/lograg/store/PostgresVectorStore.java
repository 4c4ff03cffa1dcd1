package ch.so.arp.lograg.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL backed {@link VectorStore} using the pgvector extension. The
 * tables are described in {@code db/lograg-schema.sql}. Collections are rows in
 * {@code lograg_collections}; points of all collections share
 * {@code lograg_points} and are keyed by {@code (collection, id)}.
 */
class PostgresVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresVectorStore.class);

    private static final String CREATE_COLLECTION_SQL = """
            INSERT INTO lograg_collections (name, dimensions, metric)
            VALUES (:name, :dimensions, :metric)
            ON CONFLICT (name) DO NOTHING
            """;

    private static final String DIMENSIONS_SQL = """
            SELECT dimensions FROM lograg_collections WHERE name = :name
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO lograg_points (collection, id, content, metadata, embedding)
            VALUES (:collection, :id, :content, :metadata::jsonb, :embedding::vector)
            ON CONFLICT (collection, id) DO UPDATE
              SET content = EXCLUDED.content,
                  metadata = EXCLUDED.metadata,
                  embedding = EXCLUDED.embedding
            """;

    private static final String SEARCH_SQL = """
            SELECT
              p.id AS id,
              p.content AS content,
              p.metadata::text AS metadata,
              (1.0 - (p.embedding <=> :embedding::vector)) AS score
            FROM lograg_points p
            WHERE p.collection = :collection
            ORDER BY p.embedding <=> :embedding::vector
            LIMIT :limit
            """;

    private static final String COUNT_SQL = """
            SELECT count(*) FROM lograg_points WHERE collection = :collection
            """;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    PostgresVectorStore(JdbcClient jdbcClient, ObjectMapper objectMapper) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void createCollection(String collection, int dimensions, DistanceMetric metric) {
        int created;
        try {
            created = jdbcClient.sql(CREATE_COLLECTION_SQL)
                    .param("name", collection)
                    .param("dimensions", dimensions)
                    .param("metric", metric.name())
                    .update();
        } catch (DataAccessException ex) {
            throw new VectorStoreException("Unable to create collection '" + collection + "'", ex);
        }
        if (created > 0) {
            LOGGER.info("Collection '{}' created.", collection);
            return;
        }
        int existing = dimensionsOf(collection)
                .orElseThrow(() -> new VectorStoreException("Collection '" + collection + "' could not be created"));
        if (existing != dimensions) {
            throw new VectorStoreException("Collection '" + collection + "' exists with " + existing
                    + " dimensions, requested " + dimensions);
        }
        LOGGER.info("Collection '{}' already exists.", collection);
    }

    @Override
    public boolean collectionExists(String collection) {
        return dimensionsOf(collection).isPresent();
    }

    @Override
    public void upsert(String collection, List<VectorEntry> entries) {
        int dimensions = dimensionsOf(collection)
                .orElseThrow(() -> new VectorStoreException("Collection '" + collection + "' does not exist"));
        for (VectorEntry entry : entries) {
            if (entry.vector().length != dimensions) {
                throw new VectorStoreException("Vector of point " + entry.id() + " has " + entry.vector().length
                        + " dimensions, collection '" + collection + "' expects " + dimensions);
            }
            try {
                jdbcClient.sql(UPSERT_SQL)
                        .param("collection", collection)
                        .param("id", entry.id())
                        .param("content", entry.text())
                        .param("metadata", writeMetadata(entry.metadata()))
                        .param("embedding", toPgVectorLiteral(entry.vector()))
                        .update();
            } catch (DataAccessException ex) {
                throw new VectorStoreException("Upsert of point " + entry.id() + " into '" + collection + "' failed",
                        ex);
            }
        }
        LOGGER.debug("Upserted {} points into '{}'", entries.size(), collection);
    }

    @Override
    public List<SearchHit> similaritySearch(String collection, float[] vector, int limit) {
        try {
            return jdbcClient.sql(SEARCH_SQL)
                    .param("collection", collection)
                    .param("embedding", toPgVectorLiteral(vector))
                    .param("limit", limit)
                    .query(new SearchHitMapper())
                    .list();
        } catch (DataAccessException ex) {
            throw new VectorStoreException("Similarity search in '" + collection + "' failed", ex);
        }
    }

    @Override
    public long pointCount(String collection) {
        try {
            return jdbcClient.sql(COUNT_SQL)
                    .param("collection", collection)
                    .query(Long.class)
                    .single();
        } catch (DataAccessException ex) {
            throw new VectorStoreException("Unable to count points of '" + collection + "'", ex);
        }
    }

    private Optional<Integer> dimensionsOf(String collection) {
        try {
            return jdbcClient.sql(DIMENSIONS_SQL)
                    .param("name", collection)
                    .query(Integer.class)
                    .optional();
        } catch (DataAccessException ex) {
            throw new VectorStoreException("Unable to look up collection '" + collection + "'", ex);
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new VectorStoreException("Metadata cannot be serialized", ex);
        }
    }

    private String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    private final class SearchHitMapper implements RowMapper<SearchHit> {

        @Override
        public SearchHit mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> metadata;
            try {
                metadata = objectMapper.readValue(rs.getString("metadata"), METADATA_TYPE);
            } catch (JsonProcessingException ex) {
                throw new VectorStoreException("Stored metadata of point " + rs.getString("id") + " is not JSON", ex);
            }
            return new SearchHit(rs.getString("id"), rs.getString("content"), metadata, rs.getDouble("score"));
        }
    }
}
