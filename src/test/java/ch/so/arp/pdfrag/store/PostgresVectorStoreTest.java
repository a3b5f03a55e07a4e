package ch.so.arp.pdfrag.store;

import static ch.so.arp.pdfrag.store.VectorRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import ch.so.arp.pdfrag.exception.ConfigurationException;
import ch.so.arp.pdfrag.exception.DimensionMismatchException;

@Testcontainers(disabledWithoutDocker = true)
class PostgresVectorStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(
            DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

    private static JdbcClient jdbcClient;
    private static TransactionTemplate transactionTemplate;

    private PostgresVectorStore store;

    @BeforeAll
    static void setUpDatabase() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(), POSTGRES.getPassword());
        jdbcClient = JdbcClient.create(dataSource);
        transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        new PostgresVectorStore(jdbcClient, transactionTemplate, 3, 3).initializeSchema();
    }

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM documents").update();
        store = new PostgresVectorStore(jdbcClient, transactionTemplate, 3, 3);
    }

    @Test
    void verifiesConfiguredDimension() {
        store.verifyDimension();

        PostgresVectorStore drifted = new PostgresVectorStore(jdbcClient, transactionTemplate, 1536, 3);
        assertThatThrownBy(drifted::verifyDimension)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("dimension 3");
    }

    @Test
    void insertsEachChunkOnlyOnce() {
        int first = store.upsertChunks(List.of(
                record("fp-1", 0, new float[] { 1, 0, 0 }, NOW),
                record("fp-1", 1, new float[] { 0, 1, 0 }, NOW)));
        int second = store.upsertChunks(List.of(
                record("fp-1", 0, new float[] { 1, 0, 0 }, NOW),
                record("fp-1", 1, new float[] { 0, 1, 0 }, NOW)));

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThat(store.countByFingerprint("fp-1")).isEqualTo(2);
        assertThat(store.existsFingerprint("fp-1")).isTrue();
        assertThat(store.existsFingerprint("unknown")).isFalse();
    }

    @Test
    void returnsNearestChunksWithMetadata() {
        store.upsertChunks(List.of(
                record("fp", 0, new float[] { 0, 1, 0 }, NOW),
                record("fp", 1, new float[] { 1, 0, 0 }, NOW),
                record("fp", 2, new float[] { 1, 1, 0 }, NOW)));

        List<SimilarityMatch> matches = store.similaritySearch(new float[] { 1, 0, 0 }, 2);

        assertThat(matches).extracting(match -> match.record().chunkIndex()).containsExactly(1, 2);
        assertThat(matches.get(0).score()).isCloseTo(1.0d, within(1e-6));
        assertThat(matches.get(0).record().source()).isEqualTo("fp.pdf");
        assertThat(matches.get(0).record().fingerprint()).isEqualTo("fp");
        assertThat(matches.get(0).record().embedding()).containsExactly(1f, 0f, 0f);
        assertThat(matches.get(0).record().createdAt()).isEqualTo(NOW);
    }

    @Test
    void prefersOlderChunksWhenScoresTieAtTheCutOff() {
        store.upsertChunks(List.of(record("newest", 0, new float[] { 1, 0, 0 }, NOW.plusSeconds(120))));
        store.upsertChunks(List.of(record("newer", 0, new float[] { 1, 0, 0 }, NOW.plusSeconds(60))));
        store.upsertChunks(List.of(
                record("oldest", 1, new float[] { 1, 0, 0 }, NOW),
                record("oldest", 0, new float[] { 1, 0, 0 }, NOW)));

        List<SimilarityMatch> matches = store.similaritySearch(new float[] { 1, 0, 0 }, 2);

        assertThat(matches).extracting(match -> match.record().fingerprint() + "#" + match.record().chunkIndex())
                .containsExactly("oldest#0", "oldest#1");
    }

    @Test
    void rejectsVectorsOfWrongDimension() {
        assertThatThrownBy(() -> store.upsertChunks(List.of(record("fp", 0, new float[] { 1, 0 }, NOW))))
                .isInstanceOf(DimensionMismatchException.class);
        assertThat(store.existsFingerprint("fp")).isFalse();
    }
}
