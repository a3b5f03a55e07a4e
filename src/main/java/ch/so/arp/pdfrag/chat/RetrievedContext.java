package ch.so.arp.pdfrag.chat;

import java.util.UUID;

import ch.so.arp.pdfrag.store.SimilarityMatch;

/**
 * Passage returned by the retrieval step together with its similarity score.
 */
public record RetrievedContext(UUID id, String source, int chunkIndex, String content, double score) {

    static RetrievedContext from(SimilarityMatch match) {
        return new RetrievedContext(match.record().id(), match.record().source(), match.record().chunkIndex(),
                match.record().content(), match.score());
    }

    /**
     * Formats the passage for a prompt. The source filename is kept next to the text
     * so that the model can refer to it.
     */
    public String formatForPrompt() {
        return "[Source: " + (source == null ? "unknown" : source) + ", chunk " + chunkIndex + "]\n" + content;
    }
}
