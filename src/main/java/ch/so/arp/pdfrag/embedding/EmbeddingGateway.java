package ch.so.arp.pdfrag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.pdfrag.exception.ConfigurationException;
import ch.so.arp.pdfrag.exception.DimensionMismatchException;
import ch.so.arp.pdfrag.exception.EmbeddingProviderException;

/**
 * Sends texts to the {@link EmbeddingProvider} in bounded batches and makes sure
 * every returned vector has the dimension of the vector store.
 */
public class EmbeddingGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final EmbeddingProvider provider;
    private final TokenCounter tokenCounter;
    private final int dimension;
    private final int batchSize;
    private final int maxBatchTokens;

    public EmbeddingGateway(EmbeddingProvider provider, TokenCounter tokenCounter, int dimension, int batchSize,
            int maxBatchTokens) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        if (dimension <= 0 || batchSize <= 0 || maxBatchTokens <= 0) {
            throw new IllegalArgumentException("dimension, batchSize and maxBatchTokens must be positive");
        }
        this.dimension = dimension;
        this.batchSize = batchSize;
        this.maxBatchTokens = maxBatchTokens;
    }

    /**
     * Embed document chunks.
     *
     * @throws DimensionMismatchException if any vector has the wrong dimension
     * @throws EmbeddingProviderException if the provider fails
     */
    public List<float[]> embedDocuments(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        List<List<String>> batches = partition(texts);
        for (int i = 0; i < batches.size(); i++) {
            List<String> batch = batches.get(i);
            LOGGER.debug("Embedding batch {}/{} with {} texts", i + 1, batches.size(), batch.size());
            for (float[] vector : call(batch)) {
                if (vector.length != dimension) {
                    LOGGER.error("Embedding provider returned {} dimensions, the store is configured for {}",
                            vector.length, dimension);
                    throw new DimensionMismatchException(dimension, vector.length);
                }
                vectors.add(vector);
            }
        }
        return vectors;
    }

    /**
     * Embed a user query. A wrong dimension here means that the query model differs
     * from the one the documents were embedded with.
     *
     * @throws ConfigurationException if the vector has the wrong dimension
     */
    public float[] embedQuery(String query) {
        float[] vector = call(List.of(query)).get(0);
        if (vector.length != dimension) {
            LOGGER.error("Query embedding has {} dimensions, the store is configured for {}", vector.length,
                    dimension);
            throw new ConfigurationException("Query embedding dimension " + vector.length
                    + " does not match the configured dimension " + dimension);
        }
        return vector;
    }

    List<List<String>> partition(List<String> texts) {
        List<List<String>> batches = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentTokens = 0;
        for (String text : texts) {
            int tokens = tokenCounter.count(text);
            if (!current.isEmpty() && (current.size() == batchSize || currentTokens + tokens > maxBatchTokens)) {
                batches.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(text);
            currentTokens += tokens;
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    private List<float[]> call(List<String> batch) {
        List<float[]> vectors;
        try {
            vectors = provider.embed(batch);
        } catch (EmbeddingProviderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new EmbeddingProviderException("Embedding provider failed: " + ex.getMessage(), ex);
        }
        if (vectors == null || vectors.size() != batch.size()) {
            throw new EmbeddingProviderException("Embedding provider returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + batch.size() + " inputs", null);
        }
        return vectors;
    }
}
