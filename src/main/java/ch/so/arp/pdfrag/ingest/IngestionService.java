package ch.so.arp.pdfrag.ingest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.pdfrag.embedding.EmbeddingGateway;
import ch.so.arp.pdfrag.store.VectorRecord;
import ch.so.arp.pdfrag.store.VectorStore;

/**
 * Turns an uploaded PDF into stored chunk vectors: extraction, fingerprinting,
 * chunking, embedding and persistence. Ingestion is idempotent per content
 * fingerprint and all-or-nothing: a failure in any stage leaves no rows behind.
 */
@Service
public class IngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionService.class);

    private final TextExtractor textExtractor;
    private final ContentFingerprinter fingerprinter;
    private final TextChunker chunker;
    private final EmbeddingGateway embeddingGateway;
    private final VectorStore vectorStore;
    private final Executor ragExecutor;

    public IngestionService(TextExtractor textExtractor, ContentFingerprinter fingerprinter, TextChunker chunker,
            EmbeddingGateway embeddingGateway, VectorStore vectorStore, Executor ragExecutor) {
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingGateway = Objects.requireNonNull(embeddingGateway, "embeddingGateway");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.ragExecutor = Objects.requireNonNull(ragExecutor, "ragExecutor");
    }

    public CompletableFuture<IngestionResult> ingestAsync(byte[] content, String filename) {
        return CompletableFuture.supplyAsync(() -> ingest(content, filename), ragExecutor);
    }

    public IngestionResult ingest(byte[] content, String filename) {
        LOGGER.info("Processing document: {} ({} bytes)", filename, content == null ? 0 : content.length);
        ExtractedDocument document = textExtractor.extract(content, filename);
        if (fingerprinter.normalize(document.text()).isEmpty()) {
            LOGGER.info("Document {} contains no extractable text", filename);
            return IngestionResult.noContent(filename);
        }

        String fingerprint = fingerprinter.fingerprint(document.text());
        if (vectorStore.existsFingerprint(fingerprint)) {
            LOGGER.info("Document {} already exists in the store (fingerprint {}...)", filename,
                    fingerprint.substring(0, 16));
            return IngestionResult.alreadyProcessed(filename, fingerprint, vectorStore.countByFingerprint(fingerprint));
        }

        List<TextChunk> chunks = chunker.split(document.text());
        LOGGER.info("Split document {} into {} chunks", filename, chunks.size());
        List<float[]> embeddings = embeddingGateway.embedDocuments(chunks.stream().map(TextChunk::text).toList());

        Instant createdAt = Instant.now();
        List<VectorRecord> records = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            records.add(new VectorRecord(UUID.randomUUID(), chunk.text(), embeddings.get(chunk.index()),
                    metadata(fingerprint, chunk.index(), chunks.size(), filename, document.pageCount()), filename,
                    createdAt));
        }
        int inserted = vectorStore.upsertChunks(records);
        if (inserted == 0) {
            LOGGER.info("Document {} was stored by a concurrent upload, nothing inserted", filename);
            return IngestionResult.alreadyProcessed(filename, fingerprint, chunks.size());
        }
        LOGGER.info("Successfully stored {} chunks for document: {}", inserted, filename);
        return IngestionResult.processed(filename, fingerprint, chunks.size());
    }

    private static Map<String, Object> metadata(String fingerprint, int chunkIndex, int totalChunks, String source,
            int pageCount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(VectorRecord.FINGERPRINT, fingerprint);
        metadata.put(VectorRecord.CHUNK_INDEX, chunkIndex);
        metadata.put(VectorRecord.TOTAL_CHUNKS, totalChunks);
        metadata.put(VectorRecord.SOURCE, source);
        metadata.put(VectorRecord.PAGE_COUNT, pageCount);
        return metadata;
    }
}
