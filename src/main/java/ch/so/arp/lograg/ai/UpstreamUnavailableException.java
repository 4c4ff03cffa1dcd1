package ch.so.arp.lograg.ai;

/**
 * Raised when the embedding or generation service cannot be reached, times out
 * or answers with an error. No retry happens inside the application.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public UpstreamUnavailableException(String message) {
        super(message);
    }
}
