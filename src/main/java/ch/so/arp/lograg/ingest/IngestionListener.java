package ch.so.arp.lograg.ingest;

/**
 * Receives a progress signal after each log file of a run.
 */
@FunctionalInterface
public interface IngestionListener {

    /**
     * @param outcome  the terminal state of the file
     * @param position one based position of the file in the run
     * @param total    number of discovered files
     */
    void onFileProcessed(FileOutcome outcome, int position, int total);
}
