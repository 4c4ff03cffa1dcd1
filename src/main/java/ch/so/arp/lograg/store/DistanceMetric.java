package ch.so.arp.lograg.store;

/**
 * Similarity metric of a collection. Scores are cosine similarities in the
 * range {@code [-1, 1]}, higher meaning closer.
 */
public enum DistanceMetric {
    COSINE
}
