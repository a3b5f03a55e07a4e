package ch.so.arp.pdfrag.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

/**
 * Settings of the ingestion and retrieval pipeline. They are bound once at startup;
 * changing them requires a restart.
 */
@Validated
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    /**
     * Use deterministic embeddings and a canned language model instead of OpenAI.
     */
    private boolean mockOpenai = true;

    /**
     * Keep vectors in memory instead of PostgreSQL.
     */
    private boolean mockVectorStore = true;

    @Valid
    private final Chunking chunking = new Chunking();

    @Valid
    private final Embedding embedding = new Embedding();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Store store = new Store();

    @Valid
    private final Worker worker = new Worker();

    private final Web web = new Web();

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public boolean isMockVectorStore() {
        return mockVectorStore;
    }

    public void setMockVectorStore(boolean mockVectorStore) {
        this.mockVectorStore = mockVectorStore;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Store getStore() {
        return store;
    }

    public Worker getWorker() {
        return worker;
    }

    public Web getWeb() {
        return web;
    }

    public static class Chunking {

        /**
         * Maximum number of characters per chunk.
         */
        @Positive
        private int size = 1000;

        /**
         * Number of characters shared by consecutive chunks.
         */
        @Min(0)
        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        @AssertTrue(message = "rag.chunking.overlap must be smaller than rag.chunking.size")
        public boolean isOverlapSmallerThanSize() {
            return overlap < size;
        }
    }

    public static class Embedding {

        /**
         * Dimension D of every stored vector. Must match the embedding model and the
         * {@code vector(D)} column.
         */
        @Positive
        private int dimension = 1536;

        /**
         * Maximum number of texts per embedding request.
         */
        @Positive
        private int batchSize = 64;

        /**
         * Maximum number of tokens per embedding request.
         */
        @Positive
        private int maxBatchTokens = 250_000;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxBatchTokens() {
            return maxBatchTokens;
        }

        public void setMaxBatchTokens(int maxBatchTokens) {
            this.maxBatchTokens = maxBatchTokens;
        }
    }

    public static class Retrieval {

        /**
         * Number of passages handed to the language model.
         */
        @Positive
        private int topK = 3;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    public static class Store {

        /**
         * Create extension, table and indexes on startup.
         */
        private boolean initializeSchema = false;

        /**
         * How often a failed chunk batch write is attempted in total.
         */
        @Positive
        private int writeAttempts = 3;

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }

        public int getWriteAttempts() {
            return writeAttempts;
        }

        public void setWriteAttempts(int writeAttempts) {
            this.writeAttempts = writeAttempts;
        }
    }

    public static class Worker {

        @Positive
        private int poolSize = 8;

        @Min(0)
        private int queueCapacity = 100;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Web {

        /**
         * Origins allowed to call the API from a browser.
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
