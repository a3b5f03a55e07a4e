package ch.so.arp.pdfrag.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import ch.so.arp.pdfrag.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.pdfrag.embedding.EmbeddingGateway;
import ch.so.arp.pdfrag.embedding.EmbeddingProvider;
import ch.so.arp.pdfrag.embedding.TokenCounter;
import ch.so.arp.pdfrag.exception.DimensionMismatchException;
import ch.so.arp.pdfrag.exception.ExtractionException;
import ch.so.arp.pdfrag.exception.StoreException;
import ch.so.arp.pdfrag.store.InMemoryVectorStore;
import ch.so.arp.pdfrag.store.VectorStore;

class IngestionServiceTest {

    private static final int DIMENSION = 1536;

    /**
     * Treats the uploaded bytes as UTF-8 text so tests can focus on the pipeline.
     */
    private static final TextExtractor PLAIN_TEXT = (content, filename) -> {
        if (content.length == 0) {
            throw new ExtractionException(filename, "the file is empty");
        }
        return new ExtractedDocument(new String(content, StandardCharsets.UTF_8), 1);
    };

    private final InMemoryVectorStore store = new InMemoryVectorStore(DIMENSION);

    @Test
    void storesOneRowPerChunk() {
        IngestionService service = service(new DeterministicEmbeddingProvider(DIMENSION), store, 500, 50);

        IngestionResult result = service.ingest(bytes("x".repeat(2700)), "plan.pdf");

        assertThat(result.outcome()).isEqualTo(IngestionOutcome.PROCESSED);
        assertThat(result.chunkCount()).isEqualTo(6);
        assertThat(result.fingerprint()).hasSize(64);
        assertThat(result.message()).isEqualTo("Document 'plan.pdf' processed and stored successfully (6 chunks).");
        assertThat(store.size()).isEqualTo(6);
        assertThat(store.countByFingerprint(result.fingerprint())).isEqualTo(6);
    }

    @Test
    void ingestingSameContentTwiceKeepsOneRowSet() {
        IngestionService service = service(new DeterministicEmbeddingProvider(DIMENSION), store, 200, 20);
        String text = "Der Zonenplan legt die Nutzung fest. ".repeat(30);

        IngestionResult first = service.ingest(bytes(text), "zonenplan.pdf");
        IngestionResult second = service.ingest(bytes("  " + text.replace(" ", "\n ") + "\n"), "kopie.pdf");

        assertThat(first.outcome()).isEqualTo(IngestionOutcome.PROCESSED);
        assertThat(second.outcome()).isEqualTo(IngestionOutcome.ALREADY_PROCESSED);
        assertThat(second.fingerprint()).isEqualTo(first.fingerprint());
        assertThat(second.chunkCount()).isEqualTo(first.chunkCount());
        assertThat(second.message()).isEqualTo("Document 'kopie.pdf' already processed and stored.");
        assertThat(store.size()).isEqualTo(first.chunkCount());
    }

    @Test
    void reportsDocumentsWithoutText() {
        IngestionService service = service(new DeterministicEmbeddingProvider(DIMENSION), store, 500, 50);

        IngestionResult result = service.ingest(bytes(" \n\n "), "scan.pdf");

        assertThat(result.outcome()).isEqualTo(IngestionOutcome.NO_CONTENT);
        assertThat(result.fingerprint()).isNull();
        assertThat(result.chunkCount()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void rejectsEmbeddingsOfWrongDimensionWithoutWritingRows() {
        IngestionService service = service(new DeterministicEmbeddingProvider(768), store, 500, 50);

        assertThatThrownBy(() -> service.ingest(bytes("Some content worth embedding."), "small.pdf"))
                .isInstanceOfSatisfying(DimensionMismatchException.class, ex -> {
                    assertThat(ex.getExpected()).isEqualTo(1536);
                    assertThat(ex.getActual()).isEqualTo(768);
                });
        assertThat(store.size()).isZero();
    }

    @Test
    void propagatesExtractionFailures() {
        IngestionService service = service(new DeterministicEmbeddingProvider(DIMENSION), store, 500, 50);

        assertThatThrownBy(() -> service.ingest(new byte[0], "empty.pdf")).isInstanceOf(ExtractionException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void propagatesStoreFailures() {
        VectorStore failingStore = mock(VectorStore.class);
        when(failingStore.existsFingerprint(anyString())).thenReturn(false);
        when(failingStore.upsertChunks(anyList()))
                .thenThrow(new StoreException("connection refused", new IllegalStateException("down")));
        IngestionService service = service(new DeterministicEmbeddingProvider(DIMENSION), failingStore, 500, 50);

        assertThatThrownBy(() -> service.ingest(bytes("Text"), "plan.pdf")).isInstanceOf(StoreException.class);
    }

    @Test
    void concurrentIdenticalUploadsStoreExactlyOneRowSet() throws Exception {
        IngestionService service = service(new DeterministicEmbeddingProvider(DIMENSION), store, 300, 30);
        String text = "Gleichzeitiger Upload desselben Dokuments. ".repeat(40);
        int uploads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(uploads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<CompletableFuture<IngestionResult>> futures = new ArrayList<>();
            for (int i = 0; i < uploads; i++) {
                String filename = "upload-" + i + ".pdf";
                futures.add(CompletableFuture.supplyAsync(() -> {
                    await(start);
                    return service.ingest(bytes(text), filename);
                }, pool));
            }
            start.countDown();
            List<IngestionResult> results = futures.stream().map(CompletableFuture::join).toList();

            assertThat(results).filteredOn(result -> result.outcome() == IngestionOutcome.PROCESSED).hasSize(1);
            assertThat(results).extracting(IngestionResult::fingerprint).containsOnly(results.get(0).fingerprint());
            int chunkCount = results.get(0).chunkCount();
            assertThat(store.size()).isEqualTo(chunkCount);
        } finally {
            pool.shutdownNow();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void ingestAsyncRunsOnGivenExecutor() {
        List<Runnable> submitted = new ArrayList<>();
        IngestionService service = new IngestionService(PLAIN_TEXT, new ContentFingerprinter(),
                new TextChunker(500, 50), gateway(new DeterministicEmbeddingProvider(DIMENSION)), store,
                command -> {
                    submitted.add(command);
                    command.run();
                });

        IngestionResult result = service.ingestAsync(bytes("Async"), "async.pdf").join();

        assertThat(submitted).hasSize(1);
        assertThat(result.outcome()).isEqualTo(IngestionOutcome.PROCESSED);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    private static IngestionService service(EmbeddingProvider provider, VectorStore vectorStore, int size,
            int overlap) {
        return new IngestionService(PLAIN_TEXT, new ContentFingerprinter(), new TextChunker(size, overlap),
                gateway(provider), vectorStore, Runnable::run);
    }

    private static EmbeddingGateway gateway(EmbeddingProvider provider) {
        return new EmbeddingGateway(provider, new TokenCounter("text-embedding-3-small"), DIMENSION, 64, 250_000);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
