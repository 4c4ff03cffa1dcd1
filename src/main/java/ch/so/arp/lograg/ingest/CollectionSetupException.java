package ch.so.arp.lograg.ingest;

/**
 * The target collection could not be created or verified. Fatal for the run.
 */
public class CollectionSetupException extends IngestionException {

    public CollectionSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
