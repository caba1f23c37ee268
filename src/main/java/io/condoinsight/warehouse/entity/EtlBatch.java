package io.condoinsight.warehouse.entity;

import io.condoinsight.warehouse.contract.ContractReport;
import io.condoinsight.warehouse.entity.converter.ContractReportMapConverter;
import io.condoinsight.warehouse.entity.converter.StringMapConverter;
import io.condoinsight.warehouse.entity.converter.ValidationIssueListConverter;
import io.condoinsight.warehouse.validation.ValidationIssue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JPA Entity for the etl_batches table.
 * One audit row per ingestion run, updated by every stage of the run.
 */
@Entity
@Table(name = "etl_batches", indexes = {
    @Index(name = "idx_etl_batches_status", columnList = "status"),
    @Index(name = "idx_etl_batches_started_at", columnList = "started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlBatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "batch_id", nullable = false, unique = true, length = 36)
    private String batchId;

    @Column(name = "status", nullable = false, length = 20)
    private BatchStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_mode", length = 20)
    private RunMode runMode;

    @Column(name = "triggered_by", length = 100)
    private String triggeredBy;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "total_files")
    @Builder.Default
    private Integer totalFiles = 0;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "file_fingerprints", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> fileFingerprints = new LinkedHashMap<>();

    @Column(name = "schema_version", length = 50)
    private String schemaVersion;

    @Column(name = "rules_version", length = 32)
    private String rulesVersion;

    @Column(name = "contract_hash", length = 32)
    private String contractHash;

    @Column(name = "header_fingerprint", length = 32)
    private String headerFingerprint;

    @Convert(converter = ContractReportMapConverter.class)
    @Column(name = "contract_report", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, ContractReport> contractReport = new LinkedHashMap<>();

    @Column(name = "source_row_count")
    @Builder.Default
    private Long sourceRowCount = 0L;

    @Column(name = "rows_loaded")
    @Builder.Default
    private Long rowsLoaded = 0L;

    @Column(name = "rows_rejected")
    @Builder.Default
    private Long rowsRejected = 0L;

    @Column(name = "rows_skipped")
    @Builder.Default
    private Long rowsSkipped = 0L;

    @Column(name = "rows_after_dedup")
    @Builder.Default
    private Long rowsAfterDedup = 0L;

    @Column(name = "rows_outliers_marked")
    @Builder.Default
    private Long rowsOutliersMarked = 0L;

    @Column(name = "rows_promoted")
    @Builder.Default
    private Long rowsPromoted = 0L;

    @Column(name = "rows_skipped_collision")
    @Builder.Default
    private Long rowsSkippedCollision = 0L;

    @Column(name = "validation_passed")
    private Boolean validationPassed;

    @Convert(converter = ValidationIssueListConverter.class)
    @Column(name = "validation_issues", columnDefinition = "TEXT")
    @Builder.Default
    private List<ValidationIssue> validationIssues = new ArrayList<>();

    @Convert(converter = ValidationIssueListConverter.class)
    @Column(name = "semantic_warnings", columnDefinition = "TEXT")
    @Builder.Default
    private List<ValidationIssue> semanticWarnings = new ArrayList<>();

    @Column(name = "error_stage", length = 30)
    private String errorStage;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Appends a finding, replacing the list so the change is always picked up on flush.
     */
    public void addValidationIssue(ValidationIssue issue) {
        List<ValidationIssue> copy = new ArrayList<>(validationIssues == null ? List.of() : validationIssues);
        copy.add(issue);
        validationIssues = copy;
    }

    public void addSemanticWarning(ValidationIssue issue) {
        List<ValidationIssue> copy = new ArrayList<>(semanticWarnings == null ? List.of() : semanticWarnings);
        copy.add(issue);
        semanticWarnings = copy;
    }

    @PrePersist
    protected void onCreate() {
        if (startedAt == null) {
            startedAt = LocalDateTime.now();
        }
    }
}
