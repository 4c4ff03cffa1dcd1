package ch.so.arp.lograg.ingest;

/**
 * Embedding or upserting a batch failed. The remaining batches of the file are
 * not submitted and the file stays untracked.
 */
public class VectorWriteException extends IngestionException {

    public VectorWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
