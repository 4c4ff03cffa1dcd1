package ch.so.arp.lograg.store;

import java.util.Map;

/**
 * Result element of a similarity search.
 */
public record SearchHit(String id, String text, Map<String, Object> metadata, double score) {

    /**
     * @return the {@code source} metadata value, or an empty string when absent
     */
    public String source() {
        Object source = metadata.get("source");
        return source == null ? "" : source.toString();
    }
}
