package ch.so.arp.pdfrag.embedding;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.SplittableRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline {@link EmbeddingProvider} active while {@code rag.mock-openai} is set.
 * Every chunk or query is mapped to a unit vector of the configured dimension whose
 * components are drawn from a generator seeded with the text's digest. Re-uploading
 * a document or asking with a chunk's exact wording therefore reproduces the stored
 * vector, which is what the ingestion and retrieval paths need without network
 * access. Similarity between different texts carries no meaning.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private final int dimension;

    public DeterministicEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        LOGGER.info("Embedding with offline vectors of dimension {}", dimension);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        MessageDigest digest = newDigest();
        return texts.stream().map(text -> vectorFor(digest, text)).toList();
    }

    private float[] vectorFor(MessageDigest digest, String text) {
        long seed = ByteBuffer.wrap(digest.digest(text.getBytes(StandardCharsets.UTF_8))).getLong();
        SplittableRandom components = new SplittableRandom(seed);
        double[] raw = new double[dimension];
        double squares = 0.0d;
        for (int i = 0; i < dimension; i++) {
            raw[i] = components.nextDouble(-1.0d, 1.0d);
            squares += raw[i] * raw[i];
        }
        double length = squares > 0.0d ? Math.sqrt(squares) : 1.0d;
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (raw[i] / length);
        }
        return vector;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
