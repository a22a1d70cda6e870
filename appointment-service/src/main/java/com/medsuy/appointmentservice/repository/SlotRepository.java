package com.medsuy.appointmentservice.repository;

import com.medsuy.appointmentservice.model.Slot;
import com.medsuy.appointmentservice.model.SlotStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SlotRepository extends JpaRepository<Slot, Long>, JpaSpecificationExecutor<Slot> {

    /**
     * Finds a slot by ID with pessimistic write lock (SELECT ... FOR UPDATE).
     * Concurrent lockers of the same row wait until the current transaction commits
     * or rolls back.
     *
     * CRITICAL: This method MUST be called within a @Transactional context.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Slot s WHERE s.id = :id")
    Optional<Slot> findByIdWithLock(@Param("id") Long id);

    /**
     * Sets PostgreSQL's lock_timeout for the current transaction only.
     * A lock wait longer than this fails with SQLSTATE 55P03 instead of blocking forever.
     *
     * @param timeout PostgreSQL interval literal, e.g. "3000ms"
     */
    @Query(value = "SELECT set_config('lock_timeout', :timeout, true)", nativeQuery = true)
    String applyLockTimeout(@Param("timeout") String timeout);

    @Override
    @EntityGraph(attributePaths = { "doctor", "branch" })
    List<Slot> findAll(Specification<Slot> spec, Sort sort);

    @EntityGraph(attributePaths = { "doctor", "branch" })
    List<Slot> findByHolderIdAndStatusAndScheduledAtGreaterThanEqualOrderByScheduledAtAsc(
            Long holderId, SlotStatus status, LocalDateTime from);
}
