package ch.so.arp.lograg.ingest;

/**
 * The tracker file cannot be read or written. Fatal for the run.
 */
public class IngestionTrackerException extends IngestionException {

    public IngestionTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
