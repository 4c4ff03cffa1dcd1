package ch.so.arp.lograg.ingest;

/**
 * Durable set of log files that were completely written to the vector store.
 * A file is marked only after all of its chunks were stored, so a marked file
 * is never processed again unless the record is cleared externally.
 */
public interface IngestionTracker {

    boolean has(String fileId);

    void mark(String fileId);
}
