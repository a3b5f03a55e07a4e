package ch.so.arp.pdfrag.store;

import java.util.List;

import ch.so.arp.pdfrag.exception.StoreException;

/**
 * Owns all access to the persisted chunk vectors. Implementations throw
 * {@link StoreException} when the underlying store cannot be reached.
 */
public interface VectorStore {

    /**
     * Insert all records as one unit. Records whose fingerprint and chunk index are
     * already stored are skipped.
     *
     * @param records the records to insert, all of the store's dimension
     * @return the number of records actually inserted
     */
    int upsertChunks(List<VectorRecord> records);

    /**
     * Find the records closest to the query vector under cosine similarity.
     *
     * @param queryEmbedding the query vector
     * @param k              the maximum number of matches to return
     * @return at most {@code k} matches ordered by descending score, ties broken by
     *         the earliest creation timestamp
     */
    List<SimilarityMatch> similaritySearch(float[] queryEmbedding, int k);

    boolean existsFingerprint(String fingerprint);

    int countByFingerprint(String fingerprint);
}
