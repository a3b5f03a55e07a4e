package ch.so.arp.pdfrag.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.pdfrag.chat.AnswerComposer;
import ch.so.arp.pdfrag.chat.LlmClient;
import ch.so.arp.pdfrag.chat.MockLlmClient;
import ch.so.arp.pdfrag.chat.RetrievalEngine;
import ch.so.arp.pdfrag.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.pdfrag.embedding.EmbeddingGateway;
import ch.so.arp.pdfrag.embedding.EmbeddingProvider;
import ch.so.arp.pdfrag.embedding.TokenCounter;
import ch.so.arp.pdfrag.ingest.ContentFingerprinter;
import ch.so.arp.pdfrag.ingest.PdfTextExtractor;
import ch.so.arp.pdfrag.ingest.TextChunker;
import ch.so.arp.pdfrag.ingest.TextExtractor;
import ch.so.arp.pdfrag.openai.OpenAiClientProperties;
import ch.so.arp.pdfrag.openai.OpenAiEmbeddingProvider;
import ch.so.arp.pdfrag.openai.OpenAiHttpClient;
import ch.so.arp.pdfrag.openai.OpenAiLlmClient;
import ch.so.arp.pdfrag.store.InMemoryVectorStore;
import ch.so.arp.pdfrag.store.PostgresVectorStore;
import ch.so.arp.pdfrag.store.VectorStore;

/**
 * Central configuration wiring the pipeline components together. It exposes toggles
 * that decide whether mocked or real infrastructure components should be used.
 */
@Configuration
@EnableConfigurationProperties({ RagProperties.class, OpenAiClientProperties.class })
public class RagConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "ragExecutor")
    public ThreadPoolTaskExecutor ragExecutor(RagProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorker().getPoolSize());
        executor.setMaxPoolSize(properties.getWorker().getPoolSize());
        executor.setQueueCapacity(properties.getWorker().getQueueCapacity());
        executor.setThreadNamePrefix("rag-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public TextExtractor textExtractor() {
        return new PdfTextExtractor();
    }

    @Bean
    public ContentFingerprinter contentFingerprinter() {
        return new ContentFingerprinter();
    }

    @Bean
    public TextChunker textChunker(RagProperties properties) {
        return new TextChunker(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public OpenAiHttpClient openAiHttpClient(OpenAiClientProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        return new OpenAiHttpClient(properties, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(RagProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbedding().getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiHttpClient openAiHttpClient) {
        return new OpenAiEmbeddingProvider(openAiHttpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiHttpClient openAiHttpClient) {
        return new OpenAiLlmClient(openAiHttpClient);
    }

    @Bean
    public EmbeddingGateway embeddingGateway(EmbeddingProvider embeddingProvider, RagProperties properties,
            OpenAiClientProperties openAiProperties) {
        RagProperties.Embedding embedding = properties.getEmbedding();
        return new EmbeddingGateway(embeddingProvider, new TokenCounter(openAiProperties.getEmbeddingModel()),
                embedding.getDimension(), embedding.getBatchSize(), embedding.getMaxBatchTokens());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorStore inMemoryVectorStore(RagProperties properties) {
        return new InMemoryVectorStore(properties.getEmbedding().getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "false")
    public PostgresVectorStore postgresVectorStore(JdbcClient jdbcClient, PlatformTransactionManager transactionManager,
            RagProperties properties) {
        return new PostgresVectorStore(jdbcClient, new TransactionTemplate(transactionManager),
                properties.getEmbedding().getDimension(), properties.getStore().getWriteAttempts());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "false")
    public ApplicationRunner vectorStoreSchemaRunner(PostgresVectorStore postgresVectorStore,
            RagProperties properties) {
        return args -> {
            if (properties.getStore().isInitializeSchema()) {
                postgresVectorStore.initializeSchema();
            }
            postgresVectorStore.verifyDimension();
        };
    }

    @Bean
    public RetrievalEngine retrievalEngine(EmbeddingGateway embeddingGateway, VectorStore vectorStore,
            RagProperties properties) {
        return new RetrievalEngine(embeddingGateway, vectorStore, properties.getRetrieval().getTopK());
    }

    @Bean
    public AnswerComposer answerComposer(LlmClient llmClient) {
        return new AnswerComposer(llmClient);
    }
}
