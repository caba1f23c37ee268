package io.condoinsight.warehouse.lock;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.RunLock;
import io.condoinsight.warehouse.exception.RunLockHeldException;
import io.condoinsight.warehouse.repository.RunLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * System-wide mutual exclusion between pipeline runs, backed by a single row in
 * {@code etl_run_lock}. Acquisition never waits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunLockService {

    private final RunLockRepository runLockRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * @throws RunLockHeldException if another holder already has the lock
     */
    public void acquire(String holder) {
        String lockName = properties.getLockName();
        if (!tryInsert(lockName, holder)) {
            Optional<RunLock> current = current();
            if (current.isEmpty() || !isStale(current.get()) || !takeOver(current.get(), holder)) {
                String currentHolder = current().map(RunLock::getHolder).orElse(null);
                log.error("[LOCK] {} already held by {}", lockName, currentHolder);
                throw new RunLockHeldException(lockName, currentHolder);
            }
        }
        log.info("[LOCK] {} acquired by {}", lockName, holder);
    }

    /**
     * Removes the lock whoever holds it. For an operator clearing a lock left by a
     * killed process.
     *
     * @return the lock that was removed, if there was one
     */
    public Optional<RunLock> forceRelease() {
        Optional<RunLock> current = current();
        current.ifPresent(lock -> {
            runLockRepository.deleteHeld(lock.getLockName(), lock.getHolder());
            log.warn("[LOCK] {} held by {} since {} forcibly released",
                    lock.getLockName(), lock.getHolder(), lock.getAcquiredAt());
        });
        return current;
    }

    /**
     * Releases the lock if {@code holder} owns it. Safe to call more than once.
     *
     * @return whether a row was removed
     */
    public boolean release(String holder) {
        int removed = runLockRepository.deleteHeld(properties.getLockName(), holder);
        if (removed > 0) {
            log.info("[LOCK] {} released by {}", properties.getLockName(), holder);
        }
        return removed > 0;
    }

    public Optional<RunLock> current() {
        return runLockRepository.findById(properties.getLockName());
    }

    boolean isStale(RunLock lock) {
        return lock.getAcquiredAt().isBefore(LocalDateTime.now(clock).minus(properties.getLockStaleAfter()));
    }

    private boolean tryInsert(String lockName, String holder) {
        try {
            runLockRepository.insertLock(lockName, holder, LocalDateTime.now(clock));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("[LOCK] {} insert refused: {}", lockName, e.getMostSpecificCause().getMessage());
            return false;
        }
    }

    private boolean takeOver(RunLock stale, String holder) {
        log.warn("[LOCK] {} held by {} since {} is older than {}; taking it over",
                stale.getLockName(), stale.getHolder(), stale.getAcquiredAt(), properties.getLockStaleAfter());
        // Only the stale holder's row is removed; a newer holder makes the insert fail again.
        runLockRepository.deleteHeld(stale.getLockName(), stale.getHolder());
        return tryInsert(stale.getLockName(), holder);
    }
}
