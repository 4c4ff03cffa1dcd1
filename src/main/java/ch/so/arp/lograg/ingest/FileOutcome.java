package ch.so.arp.lograg.ingest;

/**
 * Final state of one log file after an ingestion run.
 *
 * @param file       the file identifier
 * @param state      the terminal state
 * @param chunkCount the number of chunks written, zero unless tracked
 * @param message    failure or warning detail, empty otherwise
 */
public record FileOutcome(String file, FileState state, int chunkCount, String message) {

    public FileOutcome {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("A file outcome needs a terminal state, was " + state);
        }
    }

    static FileOutcome of(String file, FileState state) {
        return new FileOutcome(file, state, 0, "");
    }
}
