package ch.so.arp.lograg.ai;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline {@link EmbeddingProvider}. The text is hashed with SHA-256 together
 * with a block counter, and every 4 bytes of the digests give one component
 * in {@code [-1, 1)}. The result is normalized to unit length, so identical
 * texts get identical vectors. The vectors carry no semantic meaning.
 */
class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private static final int COMPONENTS_PER_BLOCK = 8;

    private final int dimensions;

    DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        MessageDigest sha256 = sha256();
        byte[] content = text.getBytes(StandardCharsets.UTF_8);
        float[] vector = new float[dimensions];
        double sumOfSquares = 0.0d;
        for (int block = 0; block * COMPONENTS_PER_BLOCK < dimensions; block++) {
            sha256.update(content);
            ByteBuffer digest = ByteBuffer.wrap(sha256.digest(ByteBuffer.allocate(4).putInt(block).array()));
            int end = Math.min(dimensions, (block + 1) * COMPONENTS_PER_BLOCK);
            for (int i = block * COMPONENTS_PER_BLOCK; i < end; i++) {
                vector[i] = digest.getInt() / 2147483648.0f;
                sumOfSquares += vector[i] * vector[i];
            }
        }
        double norm = Math.sqrt(sumOfSquares);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
