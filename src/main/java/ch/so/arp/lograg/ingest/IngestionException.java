package ch.so.arp.lograg.ingest;

/**
 * Base class of all failures raised while ingesting log files.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
