package ch.so.arp.lograg.store;

/**
 * Raised by {@link VectorStore} implementations for requests the store cannot
 * serve, such as writes to an unknown collection.
 */
public class VectorStoreException extends RuntimeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
