package ch.so.arp.pdfrag.store;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted unit of the vector store: one chunk of a document together with its
 * embedding and metadata. The metadata always contains {@link #FINGERPRINT} and
 * {@link #CHUNK_INDEX}. The embedding is copied on construction and compared by
 * content.
 */
public record VectorRecord(
        UUID id,
        String content,
        float[] embedding,
        Map<String, Object> metadata,
        String source,
        Instant createdAt) {

    public static final String FINGERPRINT = "fingerprint";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String TOTAL_CHUNKS = "total_chunks";
    public static final String SOURCE = "source";
    public static final String PAGE_COUNT = "page_count";

    public VectorRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(embedding, "embedding");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(createdAt, "createdAt");
        if (!(metadata.get(FINGERPRINT) instanceof String)) {
            throw new IllegalArgumentException("metadata must contain a '" + FINGERPRINT + "'");
        }
        if (!(metadata.get(CHUNK_INDEX) instanceof Number)) {
            throw new IllegalArgumentException("metadata must contain a numeric '" + CHUNK_INDEX + "'");
        }
        embedding = embedding.clone();
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VectorRecord)) {
            return false;
        }
        VectorRecord that = (VectorRecord) other;
        return id.equals(that.id)
                && content.equals(that.content)
                && Arrays.equals(embedding, that.embedding)
                && metadata.equals(that.metadata)
                && Objects.equals(source, that.source)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, content, metadata, source, createdAt) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "VectorRecord[id=" + id + ", source=" + source + ", metadata=" + metadata + ", dimension="
                + embedding.length + ", createdAt=" + createdAt + "]";
    }

    public String fingerprint() {
        return (String) metadata.get(FINGERPRINT);
    }

    public int chunkIndex() {
        return ((Number) metadata.get(CHUNK_INDEX)).intValue();
    }
}
