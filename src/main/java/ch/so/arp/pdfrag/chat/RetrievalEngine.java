package ch.so.arp.pdfrag.chat;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.pdfrag.embedding.EmbeddingGateway;
import ch.so.arp.pdfrag.store.VectorStore;

/**
 * Embeds a question with the same model as the documents and fetches the
 * {@code topK} most similar chunks. An empty store yields an empty result.
 */
public class RetrievalEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalEngine.class);

    private final EmbeddingGateway embeddingGateway;
    private final VectorStore vectorStore;
    private final int topK;

    public RetrievalEngine(EmbeddingGateway embeddingGateway, VectorStore vectorStore, int topK) {
        this.embeddingGateway = Objects.requireNonNull(embeddingGateway, "embeddingGateway");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        this.topK = topK;
    }

    public RetrievalResult retrieve(String query) {
        float[] embedding = embeddingGateway.embedQuery(query);
        List<RetrievedContext> contexts = vectorStore.similaritySearch(embedding, topK).stream()
                .map(RetrievedContext::from)
                .toList();
        LOGGER.debug("Retrieved {} passages (k={})", contexts.size(), topK);
        return new RetrievalResult(query, contexts);
    }
}
