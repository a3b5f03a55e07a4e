package ch.so.arp.pdfrag.chat;

import java.util.List;
import java.util.Objects;

/**
 * Passages retrieved for one query, ordered by descending similarity.
 */
public record RetrievalResult(String query, List<RetrievedContext> contexts) {

    public RetrievalResult {
        Objects.requireNonNull(query, "query");
        contexts = List.copyOf(contexts);
    }

    public boolean isEmpty() {
        return contexts.isEmpty();
    }

    public List<String> sources() {
        return contexts.stream().map(RetrievedContext::source).filter(Objects::nonNull).distinct().toList();
    }
}
