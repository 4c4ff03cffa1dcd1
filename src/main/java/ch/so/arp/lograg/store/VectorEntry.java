package ch.so.arp.lograg.store;

import java.util.Map;
import java.util.Objects;

/**
 * One point of a collection: the stored text, its metadata and embedding. The
 * id is chosen by the writer; upserting the same id again replaces the point.
 */
public record VectorEntry(String id, String text, Map<String, Object> metadata, float[] vector) {

    public VectorEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(vector, "vector");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
