package io.condoinsight.warehouse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for the etl_run_lock table. At most one row per lock name exists;
 * the primary key is what makes acquisition exclusive.
 */
@Entity
@Table(name = "etl_run_lock")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunLock {

    @Id
    @Column(name = "lock_name", length = 50)
    private String lockName;

    @Column(name = "holder", nullable = false, length = 100)
    private String holder;

    @Column(name = "acquired_at", nullable = false)
    private LocalDateTime acquiredAt;
}
