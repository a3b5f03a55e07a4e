package ch.so.arp.pdfrag.store;

import java.util.Comparator;

/**
 * A stored record together with its cosine similarity to a query vector.
 */
public record SimilarityMatch(VectorRecord record, double score) {

    /**
     * Descending score, then earliest creation timestamp, then chunk order.
     */
    static final Comparator<SimilarityMatch> RANKING = Comparator
            .comparingDouble(SimilarityMatch::score).reversed()
            .thenComparing((SimilarityMatch match) -> match.record().createdAt())
            .thenComparingInt(match -> match.record().chunkIndex());
}
