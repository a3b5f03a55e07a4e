package ch.so.arp.pdfrag.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.pdfrag.exception.DimensionMismatchException;

/**
 * Heap based {@link VectorStore} used for local development and tests. It keeps
 * the uniqueness and ordering guarantees of the PostgreSQL implementation and
 * computes exact cosine similarities.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final int dimension;
    private final Map<String, VectorRecord> records = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryVectorStore(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public int upsertChunks(List<VectorRecord> batch) {
        batch.forEach(record -> checkDimension(record.embedding()));
        lock.writeLock().lock();
        try {
            int inserted = 0;
            for (VectorRecord record : batch) {
                if (records.putIfAbsent(key(record.fingerprint(), record.chunkIndex()), record) == null) {
                    inserted++;
                }
            }
            LOGGER.debug("Inserted {} of {} records", inserted, batch.size());
            return inserted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SimilarityMatch> similaritySearch(float[] queryEmbedding, int k) {
        checkDimension(queryEmbedding);
        if (k <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            return records.values().stream()
                    .map(record -> new SimilarityMatch(record, cosineSimilarity(queryEmbedding, record.embedding())))
                    .sorted(SimilarityMatch.RANKING)
                    .limit(k)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean existsFingerprint(String fingerprint) {
        return countByFingerprint(fingerprint) > 0;
    }

    @Override
    public int countByFingerprint(String fingerprint) {
        lock.readLock().lock();
        try {
            return (int) records.values().stream()
                    .filter(record -> record.fingerprint().equals(fingerprint))
                    .count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void checkDimension(float[] embedding) {
        if (embedding.length != dimension) {
            throw new DimensionMismatchException(dimension, embedding.length);
        }
    }

    private static String key(String fingerprint, int chunkIndex) {
        return fingerprint + '#' + chunkIndex;
    }

    static double cosineSimilarity(float[] a, float[] b) {
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0d || normB == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
