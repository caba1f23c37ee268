package io.condoinsight.warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for the project_locations lookup table.
 */
@Entity
@Table(name = "project_locations",
    uniqueConstraints = @UniqueConstraint(name = "uq_project_locations_name", columnNames = "project_name"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "project_name", nullable = false, length = 255)
    private String projectName;

    @Column(length = 3)
    private String district;

    @Column(length = 3)
    private String region;

    @Column(name = "street_name", length = 255)
    private String streetName;

    @Column(name = "first_batch_id", length = 36)
    private String firstBatchId;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
