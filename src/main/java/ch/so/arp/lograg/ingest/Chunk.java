package ch.so.arp.lograg.ingest;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Bounded slice of a {@link Document}, stored as one point of the vector store.
 *
 * @param source        the identifier of the originating log file
 * @param documentIndex position of the document within its file
 * @param chunkIndex    position of the chunk within its document
 * @param startOffset   offset of the first character within the document text
 * @param overlap       number of leading characters repeated from the previous chunk
 * @param text          the chunk text
 */
record Chunk(String source, int documentIndex, int chunkIndex, int startOffset, int overlap, String text) {

    /**
     * Name based id, stable across runs, so that writing a file again replaces
     * its points instead of adding copies.
     */
    String pointId() {
        String name = source + "#" + documentIndex + "#" + chunkIndex;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    Map<String, Object> metadata() {
        return Map.of("source", source, "document_index", documentIndex, "chunk_index", chunkIndex);
    }
}
