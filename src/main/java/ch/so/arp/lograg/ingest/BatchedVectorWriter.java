package ch.so.arp.lograg.ingest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.lograg.ai.EmbeddingProvider;
import ch.so.arp.lograg.store.VectorEntry;
import ch.so.arp.lograg.store.VectorStore;

/**
 * Embeds chunks and upserts them into the vector store in consecutive batches,
 * pausing between batches to stay below the embedding provider's rate limit.
 * The first failing batch aborts the remaining ones.
 */
class BatchedVectorWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchedVectorWriter.class);

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final Sleeper sleeper;
    private final int batchSize;
    private final Duration pacing;

    BatchedVectorWriter(VectorStore vectorStore, EmbeddingProvider embeddingProvider, Sleeper sleeper,
            int batchSize, Duration pacing) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.batchSize = batchSize;
        this.pacing = Objects.requireNonNull(pacing, "pacing");
    }

    int write(String collection, List<Chunk> chunks) {
        return write(collection, chunks, batchSize, pacing);
    }

    /**
     * @return the number of chunks written
     * @throws VectorWriteException if embedding or upserting a batch fails
     */
    int write(String collection, List<Chunk> chunks, int batchSize, Duration pacing) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        int written = 0;
        for (int from = 0; from < chunks.size(); from += batchSize) {
            if (from > 0) {
                pause(pacing);
            }
            List<Chunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            try {
                vectorStore.upsert(collection, toEntries(batch));
            } catch (RuntimeException ex) {
                throw new VectorWriteException("Writing chunks " + from + " to " + (from + batch.size() - 1)
                        + " of " + batch.get(0).source() + " failed: " + ex.getMessage(), ex);
            }
            written += batch.size();
            LOGGER.debug("Wrote batch of {} chunks to '{}' ({}/{})", batch.size(), collection, written,
                    chunks.size());
        }
        return written;
    }

    private List<VectorEntry> toEntries(List<Chunk> batch) {
        List<float[]> vectors = embeddingProvider.embedAll(batch.stream().map(Chunk::text).toList());
        List<VectorEntry> entries = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Chunk chunk = batch.get(i);
            entries.add(new VectorEntry(chunk.pointId(), chunk.text(), chunk.metadata(), vectors.get(i)));
        }
        return entries;
    }

    private void pause(Duration pacing) {
        if (pacing.isZero() || pacing.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(pacing);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException("Interrupted while pausing between batches", ex);
        }
    }
}
