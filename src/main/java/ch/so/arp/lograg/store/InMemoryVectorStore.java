package ch.so.arp.lograg.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process local replacement for the PostgreSQL store. It performs an exact
 * cosine scan over all points, so it is meant for local development and tests
 * rather than large corpora. Points are keyed by id, which makes repeated
 * upserts of the same chunk overwrite the earlier write.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final Map<String, StoredCollection> collections = new ConcurrentHashMap<>();

    @Override
    public void createCollection(String collection, int dimensions, DistanceMetric metric) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        StoredCollection existing = collections.putIfAbsent(collection, new StoredCollection(dimensions));
        if (existing == null) {
            LOGGER.info("Collection '{}' created.", collection);
        } else if (existing.dimensions != dimensions) {
            throw new VectorStoreException("Collection '" + collection + "' exists with " + existing.dimensions
                    + " dimensions, requested " + dimensions);
        } else {
            LOGGER.info("Collection '{}' already exists.", collection);
        }
    }

    @Override
    public boolean collectionExists(String collection) {
        return collections.containsKey(collection);
    }

    @Override
    public void upsert(String collection, List<VectorEntry> entries) {
        StoredCollection target = require(collection);
        for (VectorEntry entry : entries) {
            if (entry.vector().length != target.dimensions) {
                throw new VectorStoreException("Vector of point " + entry.id() + " has " + entry.vector().length
                        + " dimensions, collection '" + collection + "' expects " + target.dimensions);
            }
        }
        synchronized (target) {
            entries.forEach(entry -> target.points.put(entry.id(), entry));
        }
    }

    @Override
    public List<SearchHit> similaritySearch(String collection, float[] vector, int limit) {
        StoredCollection target = require(collection);
        List<VectorEntry> snapshot;
        synchronized (target) {
            snapshot = new ArrayList<>(target.points.values());
        }
        return snapshot.stream()
                .map(entry -> new SearchHit(entry.id(), entry.text(), entry.metadata(), cosine(vector, entry.vector())))
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public long pointCount(String collection) {
        StoredCollection target = collections.get(collection);
        if (target == null) {
            return 0L;
        }
        synchronized (target) {
            return target.points.size();
        }
    }

    private StoredCollection require(String collection) {
        StoredCollection target = collections.get(collection);
        if (target == null) {
            throw new VectorStoreException("Collection '" + collection + "' does not exist");
        }
        return target;
    }

    private static double cosine(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new VectorStoreException("Query vector has " + left.length + " dimensions, stored vector "
                    + right.length);
        }
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private static final class StoredCollection {

        private final int dimensions;
        private final Map<String, VectorEntry> points = new LinkedHashMap<>();

        StoredCollection(int dimensions) {
            this.dimensions = dimensions;
        }
    }
}
