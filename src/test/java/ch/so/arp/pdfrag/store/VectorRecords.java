package ch.so.arp.pdfrag.store;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Test factory for {@link VectorRecord}s.
 */
final class VectorRecords {

    private VectorRecords() {
    }

    static VectorRecord record(String fingerprint, int chunkIndex, float[] embedding, Instant createdAt) {
        return new VectorRecord(UUID.randomUUID(), "chunk " + chunkIndex + " of " + fingerprint, embedding,
                Map.of(VectorRecord.FINGERPRINT, fingerprint, VectorRecord.CHUNK_INDEX, chunkIndex,
                        VectorRecord.SOURCE, fingerprint + ".pdf"),
                fingerprint + ".pdf", createdAt);
    }
}
