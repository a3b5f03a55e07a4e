package ch.so.arp.pdfrag.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import ch.so.arp.pdfrag.exception.ConfigurationException;
import ch.so.arp.pdfrag.exception.DimensionMismatchException;
import ch.so.arp.pdfrag.exception.StoreException;

/**
 * PostgreSQL/pgvector backed {@link VectorStore}. Chunks live in the
 * {@code documents} table, a unique expression index over the fingerprint and
 * chunk index in {@code cmetadata} turns duplicate inserts into no-ops. Writes of
 * one document run in a single transaction and are retried as a whole on
 * transient failures, including failures to obtain a connection.
 */
public class PostgresVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresVectorStore.class);

    private static final String INSERT_SQL = """
            INSERT INTO documents (uuid, document, embedding, cmetadata, source, created_at)
            VALUES (:id, :content, :embedding::vector, :metadata::jsonb, :source, :createdAt)
            ON CONFLICT ((cmetadata->>'fingerprint'), (cmetadata->>'chunk_index')) DO NOTHING
            """;

    // the inner query is served by the HNSW index, the outer one breaks ties
    private static final String SIMILARITY_SQL = """
            SELECT uuid, document, embedding, metadata, source, created_at, 1.0 - distance AS score
            FROM (
              SELECT
                uuid,
                document,
                embedding::text AS embedding,
                cmetadata::text AS metadata,
                (cmetadata->>'chunk_index')::int AS chunk_index,
                source,
                created_at,
                embedding <=> :embedding::vector AS distance
              FROM documents
              WHERE embedding IS NOT NULL
              ORDER BY embedding <=> :embedding::vector
              LIMIT :candidates
            ) candidates
            ORDER BY distance, created_at, chunk_index
            LIMIT :limit
            """;

    /**
     * Extra rows fetched beyond {@code k} so that rows tying at the cut-off are
     * ranked by creation time. Ties spread over more rows than this are still cut
     * in index order.
     */
    static final int TIE_CANDIDATES = 20;

    static final Duration WRITE_RETRY_WAIT = Duration.ofMillis(100);

    private static final String EXISTS_SQL = """
            SELECT EXISTS (SELECT 1 FROM documents WHERE cmetadata->>'fingerprint' = :fingerprint)
            """;

    private static final String COUNT_SQL = """
            SELECT count(*) FROM documents WHERE cmetadata->>'fingerprint' = :fingerprint
            """;

    private static final String DIMENSION_SQL = """
            SELECT a.atttypmod
            FROM pg_attribute a
            WHERE a.attrelid = to_regclass('documents')
              AND a.attname = 'embedding'
              AND NOT a.attisdropped
            """;

    private static final String SCHEMA_SQL = """
            CREATE EXTENSION IF NOT EXISTS vector;
            CREATE TABLE IF NOT EXISTS documents (
                uuid UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                document TEXT NOT NULL,
                embedding vector(%d),
                cmetadata JSONB DEFAULT '{}',
                source TEXT,
                created_at TIMESTAMP WITH TIME ZONE DEFAULT NOW()
            );
            CREATE INDEX IF NOT EXISTS documents_embedding_idx
                ON documents USING hnsw (embedding vector_cosine_ops) WITH (m = 16, ef_construction = 64);
            CREATE INDEX IF NOT EXISTS documents_source_idx ON documents (source);
            CREATE INDEX IF NOT EXISTS documents_metadata_idx ON documents USING GIN (cmetadata);
            CREATE UNIQUE INDEX IF NOT EXISTS documents_fingerprint_chunk_idx
                ON documents ((cmetadata->>'fingerprint'), (cmetadata->>'chunk_index'))
            """;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final int dimension;
    private final int writeAttempts;
    private final Retry writeRetry;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PostgresVectorStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, int dimension,
            int writeAttempts) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        if (writeAttempts <= 0) {
            throw new IllegalArgumentException("writeAttempts must be positive");
        }
        this.dimension = dimension;
        this.writeAttempts = writeAttempts;
        this.writeRetry = Retry.of("vector-store-write", RetryConfig.custom()
                .maxAttempts(writeAttempts)
                .waitDuration(WRITE_RETRY_WAIT)
                .retryExceptions(TransientDataAccessException.class, RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class, CannotCreateTransactionException.class)
                .build());
        this.writeRetry.getEventPublisher().onRetry(event -> LOGGER.warn(
                "Storing chunks failed (attempt {}/{}), retrying the whole batch: {}",
                event.getNumberOfRetryAttempts(), writeAttempts, event.getLastThrowable().getMessage()));
    }

    /**
     * Create the pgvector extension, the {@code documents} table and its indexes
     * if they do not exist yet.
     */
    public void initializeSchema() {
        LOGGER.info("Initializing vector store schema with dimension {}", dimension);
        try {
            for (String statement : SCHEMA_SQL.formatted(dimension).split(";")) {
                if (!statement.isBlank()) {
                    jdbcClient.sql(statement).update();
                }
            }
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to initialize vector store schema", ex);
        }
    }

    /**
     * Fail fast if the {@code embedding} column does not exist or was created with a
     * different dimension than the configured one.
     */
    public void verifyDimension() {
        Optional<Integer> columnDimension;
        try {
            columnDimension = jdbcClient.sql(DIMENSION_SQL).query(Integer.class).optional();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to inspect vector store schema", ex);
        }
        if (columnDimension.isEmpty()) {
            throw new ConfigurationException(
                    "Table 'documents' with an 'embedding' column does not exist; enable rag.store.initialize-schema");
        }
        int actual = columnDimension.get();
        if (actual > 0 && actual != dimension) {
            throw new ConfigurationException("Column documents.embedding has dimension " + actual
                    + " but rag.embedding.dimension is " + dimension);
        }
        LOGGER.info("Vector store schema verified (dimension {})", dimension);
    }

    @Override
    public int upsertChunks(List<VectorRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        records.forEach(record -> checkDimension(record.embedding()));
        Supplier<Integer> write = Retry.decorateSupplier(writeRetry,
                () -> transactionTemplate.execute(status -> insertAll(records)));
        try {
            Integer inserted = write.get();
            return inserted == null ? 0 : inserted;
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreException("Failed to store " + records.size() + " chunks", ex);
        }
    }

    private int insertAll(List<VectorRecord> records) {
        int inserted = 0;
        for (VectorRecord record : records) {
            inserted += jdbcClient.sql(INSERT_SQL)
                    .param("id", record.id())
                    .param("content", record.content())
                    .param("embedding", toPgVectorLiteral(record.embedding()))
                    .param("metadata", toJson(record.metadata()))
                    .param("source", record.source())
                    .param("createdAt", OffsetDateTime.ofInstant(record.createdAt(), ZoneOffset.UTC))
                    .update();
        }
        return inserted;
    }

    @Override
    public List<SimilarityMatch> similaritySearch(float[] queryEmbedding, int k) {
        checkDimension(queryEmbedding);
        if (k <= 0) {
            return List.of();
        }
        try {
            List<SimilarityMatch> matches = jdbcClient.sql(SIMILARITY_SQL)
                    .param("embedding", toPgVectorLiteral(queryEmbedding))
                    .param("candidates", k + TIE_CANDIDATES)
                    .param("limit", k)
                    .query(new MatchRowMapper())
                    .list();
            LOGGER.debug("Similarity search returned {} matches (k={})", matches.size(), k);
            return matches;
        } catch (DataAccessException ex) {
            throw new StoreException("Similarity search failed", ex);
        }
    }

    @Override
    public boolean existsFingerprint(String fingerprint) {
        try {
            return Boolean.TRUE.equals(jdbcClient.sql(EXISTS_SQL)
                    .param("fingerprint", fingerprint)
                    .query(Boolean.class)
                    .single());
        } catch (DataAccessException ex) {
            throw new StoreException("Fingerprint lookup failed", ex);
        }
    }

    @Override
    public int countByFingerprint(String fingerprint) {
        try {
            return jdbcClient.sql(COUNT_SQL)
                    .param("fingerprint", fingerprint)
                    .query(Long.class)
                    .single()
                    .intValue();
        } catch (DataAccessException ex) {
            throw new StoreException("Fingerprint count failed", ex);
        }
    }

    private void checkDimension(float[] embedding) {
        if (embedding.length != dimension) {
            throw new DimensionMismatchException(dimension, embedding.length);
        }
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Metadata is not serializable: " + metadata, ex);
        }
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder(embedding.length * 12);
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parsePgVector(String literal) {
        String body = literal.strip();
        body = body.substring(1, body.length() - 1);
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].strip());
        }
        return vector;
    }

    private final class MatchRowMapper implements RowMapper<SimilarityMatch> {

        @Override
        public SimilarityMatch mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> metadata;
            try {
                metadata = objectMapper.readValue(rs.getString("metadata"), METADATA_TYPE);
            } catch (JsonProcessingException ex) {
                throw new SQLException("Malformed metadata in row " + rs.getString("uuid"), ex);
            }
            VectorRecord record = new VectorRecord(
                    rs.getObject("uuid", UUID.class),
                    rs.getString("document"),
                    parsePgVector(rs.getString("embedding")),
                    metadata,
                    rs.getString("source"),
                    rs.getObject("created_at", OffsetDateTime.class).toInstant());
            return new SimilarityMatch(record, rs.getDouble("score"));
        }
    }
}
