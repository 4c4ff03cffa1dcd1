package ch.so.arp.lograg.ingest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.lograg.store.DistanceMetric;
import ch.so.arp.lograg.store.VectorStore;

/**
 * Incremental ingestion of log files into a vector store collection. Files are
 * processed one after another in file name order. A file is recorded in the
 * {@link IngestionTracker} only after all of its chunks were written, so any
 * failure leaves it eligible for the next run. Re-writing a file replaces its
 * points because chunk ids are stable.
 */
public class IngestionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionPipeline.class);

    private final LogFileReader reader;
    private final DocumentBuilder documentBuilder;
    private final BatchedVectorWriter writer;
    private final IngestionTracker tracker;
    private final VectorStore vectorStore;
    private final int dimensions;
    private final IngestionListener listener;

    IngestionPipeline(LogFileReader reader, DocumentBuilder documentBuilder, BatchedVectorWriter writer,
            IngestionTracker tracker, VectorStore vectorStore, int dimensions, IngestionListener listener) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.documentBuilder = Objects.requireNonNull(documentBuilder, "documentBuilder");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.dimensions = dimensions;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public IngestionReport ingest(String collection) {
        return ingest(collection, () -> false);
    }

    /**
     * Ingest all untracked log files into the collection, creating it first if
     * needed.
     *
     * @param collection            the target collection
     * @param cancellationRequested checked before each file; {@code true} ends
     *                              the run without starting further files
     * @return the per file outcomes
     * @throws CollectionSetupException if the collection cannot be created
     */
    public synchronized IngestionReport ingest(String collection, BooleanSupplier cancellationRequested) {
        ensureCollection(collection);

        List<Path> files = reader.discover();
        if (files.isEmpty()) {
            LOGGER.warn("No log files found in {}", reader.inputDirectory());
        }

        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        boolean cancelled = false;
        for (Path file : files) {
            if (cancellationRequested.getAsBoolean()) {
                LOGGER.warn("Ingestion into '{}' cancelled after {} of {} files", collection, outcomes.size(),
                        files.size());
                cancelled = true;
                break;
            }
            FileOutcome outcome = ingestFile(collection, file);
            outcomes.add(outcome);
            listener.onFileProcessed(outcome, outcomes.size(), files.size());
        }

        IngestionReport report = new IngestionReport(collection, outcomes, cancelled);
        LOGGER.info("Finished incremental ingestion to collection '{}': {}", collection, report.summary());
        return report;
    }

    private void ensureCollection(String collection) {
        try {
            vectorStore.createCollection(collection, dimensions, DistanceMetric.COSINE);
        } catch (RuntimeException ex) {
            throw new CollectionSetupException("Unable to create collection '" + collection + "'", ex);
        }
    }

    private FileOutcome ingestFile(String collection, Path file) {
        String fileId = LogFileReader.identifierOf(file);
        transition(fileId, FileState.DISCOVERED);
        if (tracker.has(fileId)) {
            LOGGER.info("File '{}' already ingested. Skipping.", fileId);
            return FileOutcome.of(fileId, FileState.SKIPPED);
        }

        LOGGER.info("Processing file: {}", fileId);
        List<ObjectNode> records;
        try {
            records = reader.read(file);
        } catch (SourceFileParseException ex) {
            LOGGER.error("Error parsing {}: {}", fileId, ex.getMessage(), ex);
            return new FileOutcome(fileId, FileState.PARSE_FAILED, 0, ex.getMessage());
        }
        transition(fileId, FileState.PARSED);

        List<Chunk> chunks = documentBuilder.build(fileId, records);
        transition(fileId, FileState.CHUNKED);
        if (chunks.isEmpty()) {
            LOGGER.warn("No chunks generated for file: {}", fileId);
            return new FileOutcome(fileId, FileState.EMPTY, 0, "file contains no log records");
        }

        int written;
        try {
            written = writer.write(collection, chunks);
        } catch (VectorWriteException ex) {
            LOGGER.error("Error writing {} to '{}': {}", fileId, collection, ex.getMessage(), ex);
            return new FileOutcome(fileId, FileState.WRITE_FAILED, 0, ex.getMessage());
        }
        transition(fileId, FileState.WRITTEN);

        tracker.mark(fileId);
        LOGGER.info("File '{}' ingested successfully with {} chunks.", fileId, written);
        return new FileOutcome(fileId, FileState.TRACKED, written, "");
    }

    private void transition(String fileId, FileState state) {
        LOGGER.debug("'{}' -> {}", fileId, state);
    }
}
