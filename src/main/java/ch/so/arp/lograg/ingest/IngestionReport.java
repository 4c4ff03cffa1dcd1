package ch.so.arp.lograg.ingest;

import java.util.List;

/**
 * Result of one ingestion run.
 *
 * @param collection the collection written to
 * @param files      one outcome per processed file, in processing order
 * @param cancelled  whether the run stopped early on request
 */
public record IngestionReport(String collection, List<FileOutcome> files, boolean cancelled) {

    public IngestionReport {
        files = List.copyOf(files);
    }

    public long count(FileState state) {
        return files.stream().filter(file -> file.state() == state).count();
    }

    public int chunksWritten() {
        return files.stream().mapToInt(FileOutcome::chunkCount).sum();
    }

    public String summary() {
        return String.format("%d ingested (%d chunks), %d skipped, %d empty, %d parse failures, %d write failures%s",
                count(FileState.TRACKED), chunksWritten(), count(FileState.SKIPPED), count(FileState.EMPTY),
                count(FileState.PARSE_FAILED), count(FileState.WRITE_FAILED), cancelled ? ", cancelled" : "");
    }
}
