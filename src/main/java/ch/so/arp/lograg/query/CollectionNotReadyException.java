package ch.so.arp.lograg.query;

/**
 * The collection to answer from does not exist or holds no points yet.
 */
public class CollectionNotReadyException extends RuntimeException {

    public CollectionNotReadyException(String message) {
        super(message);
    }
}
