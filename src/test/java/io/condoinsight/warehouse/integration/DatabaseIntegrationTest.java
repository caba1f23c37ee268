package io.condoinsight.warehouse.integration;

import io.condoinsight.warehouse.entity.BatchStatus;
import io.condoinsight.warehouse.entity.EtlBatch;
import io.condoinsight.warehouse.entity.RunMode;
import io.condoinsight.warehouse.pipeline.IngestionPipeline;
import io.condoinsight.warehouse.pipeline.PipelineResult;
import io.condoinsight.warehouse.pipeline.RunOptions;
import io.condoinsight.warehouse.repository.EtlBatchRepository;
import io.condoinsight.warehouse.repository.PromotedTransactionRepository;
import io.condoinsight.warehouse.repository.RunLockRepository;
import io.condoinsight.warehouse.support.TransactionCsv;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests using Testcontainers with a real PostgreSQL database.
 * These tests verify that promotion SQL, JSON audit columns and the run lock
 * behave the same on PostgreSQL as on H2.
 */
@SpringBootTest(properties = "etl.cli.enabled=false")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL Integration Tests with Testcontainers")
class DatabaseIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("condo_warehouse")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private IngestionPipeline pipeline;

    @Autowired
    private EtlBatchRepository batchRepository;

    @Autowired
    private PromotedTransactionRepository promotedRepository;

    @Autowired
    private RunLockRepository runLockRepository;

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should stage, promote, replay and roll back a batch on PostgreSQL")
    void shouldRunFullLifecycleOnPostgres() {
        // Given
        Path file = TransactionCsv.renaming("Sale Date", "Contract Date").rows(0, 40).writeTo(dir, "pg.csv");

        // When
        PipelineResult first = pipeline.execute(RunOptions.builder().files(List.of(file)).build());
        PipelineResult rerun = pipeline.execute(RunOptions.builder().files(List.of(file)).build());

        // Then
        assertThat(first.getExitCode()).isZero();
        assertThat(first.getPromotion().getInserted()).isEqualTo(40);
        assertThat(rerun.getPromotion().getInserted()).isZero();
        assertThat(promotedRepository.count()).isEqualTo(40L);

        EtlBatch batch = batchRepository.findByBatchId(first.getBatchId()).orElseThrow();
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(batch.getContractReport().get("pg.csv").getAliasesUsed()).containsEntry("Contract Date", "sale_date");
        assertThat(batch.getValidationIssues()).isNotEmpty();
        assertThat(runLockRepository.count()).isZero();

        // When the latest batch is rolled back
        PipelineResult rollback = pipeline.execute(RunOptions.builder().mode(RunMode.ROLLBACK).build());

        // Then the rerun batch inserted nothing, so production is untouched
        assertThat(rollback.getBatchId()).isEqualTo(rerun.getBatchId());
        assertThat(rollback.getRollback().getRowsRemoved()).isZero();
        assertThat(promotedRepository.count()).isEqualTo(40L);
    }
}
