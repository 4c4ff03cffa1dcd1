package ch.so.arp.lograg.store;

import java.util.List;

/**
 * Minimal vector store abstraction. Indexing and nearest neighbour search are
 * the store's business; callers only create collections, write points and
 * query them.
 */
public interface VectorStore {

    /**
     * Create the collection unless it already exists.
     *
     * @param collection the collection name
     * @param dimensions the length of every vector stored in the collection
     * @param metric     the similarity metric
     */
    void createCollection(String collection, int dimensions, DistanceMetric metric);

    boolean collectionExists(String collection);

    /**
     * Insert or replace points. A point whose id is already stored is
     * overwritten, never duplicated.
     *
     * @param collection the target collection, which must exist
     * @param entries    the points to write
     */
    void upsert(String collection, List<VectorEntry> entries);

    /**
     * Find the nearest points to the query vector.
     *
     * @param collection the collection to search
     * @param vector     the query embedding
     * @param limit      the maximum number of hits
     * @return hits ordered by descending score
     */
    List<SearchHit> similaritySearch(String collection, float[] vector, int limit);

    long pointCount(String collection);
}
