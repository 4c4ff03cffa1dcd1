package ch.so.arp.lograg.ingest;

/**
 * The ingesting thread was interrupted while pausing between batches.
 */
public class IngestionCancelledException extends IngestionException {

    public IngestionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
