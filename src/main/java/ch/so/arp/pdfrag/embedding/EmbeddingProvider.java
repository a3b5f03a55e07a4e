package ch.so.arp.pdfrag.embedding;

import java.util.List;

import ch.so.arp.pdfrag.exception.EmbeddingProviderException;

/**
 * Strategy abstraction used to compute embeddings. Implementations can either call
 * a remote embedding API or provide deterministic placeholders that are suited for
 * tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create one embedding vector per input text.
     *
     * @param texts the texts to embed
     * @return the embeddings in input order
     * @throws EmbeddingProviderException if the provider cannot be reached or rejects
     *                                    the request
     */
    List<float[]> embed(List<String> texts);
}
