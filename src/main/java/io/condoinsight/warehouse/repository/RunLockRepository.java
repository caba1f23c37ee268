package io.condoinsight.warehouse.repository;

import io.condoinsight.warehouse.entity.RunLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Repository for the run lock row.
 */
@Repository
public interface RunLockRepository extends JpaRepository<RunLock, String> {

    /**
     * Plain insert, so a second holder hits the primary key instead of silently
     * merging over the first.
     */
    @Transactional
    @Modifying
    @Query(value = "INSERT INTO etl_run_lock (lock_name, holder, acquired_at) VALUES (:lockName, :holder, :acquiredAt)",
        nativeQuery = true)
    int insertLock(@Param("lockName") String lockName,
                   @Param("holder") String holder,
                   @Param("acquiredAt") LocalDateTime acquiredAt);

    @Transactional
    @Modifying
    @Query("DELETE FROM RunLock l WHERE l.lockName = :lockName AND l.holder = :holder")
    int deleteHeld(@Param("lockName") String lockName, @Param("holder") String holder);
}
