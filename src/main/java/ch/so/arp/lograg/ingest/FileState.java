package ch.so.arp.lograg.ingest;

/**
 * Lifecycle of one log file within an ingestion run.
 *
 * <pre>
 * DISCOVERED -> SKIPPED
 * DISCOVERED -> PARSED -> CHUNKED -> WRITTEN -> TRACKED
 * DISCOVERED -> PARSE_FAILED
 * PARSED -> CHUNKED -> EMPTY
 * CHUNKED -> WRITE_FAILED
 * </pre>
 */
public enum FileState {
    DISCOVERED(false),
    SKIPPED(true),
    PARSED(false),
    CHUNKED(false),
    WRITTEN(false),
    TRACKED(true),
    PARSE_FAILED(true),
    EMPTY(true),
    WRITE_FAILED(true);

    private final boolean terminal;

    FileState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
