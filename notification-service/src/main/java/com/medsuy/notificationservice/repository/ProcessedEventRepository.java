package com.medsuy.notificationservice.repository;

import com.medsuy.notificationservice.model.ProcessedEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * Claims are taken with single conditional statements that report a row count.
 * A lost race yields 0 rows instead of a constraint violation, so the caller's
 * transaction is never marked rollback-only.
 */
@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEvent, String> {

    /**
     * A concurrent insert of the same key waits for the other transaction and then does nothing.
     *
     * @return 1 if the claim was inserted, 0 if the key already existed
     */
    @Modifying
    @Query(value = "INSERT INTO processed_events (event_key, created_at) VALUES (:eventKey, :createdAt) "
            + "ON CONFLICT (event_key) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("eventKey") String eventKey, @Param("createdAt") LocalDateTime createdAt);

    /**
     * Takes over a claim that was never completed and whose lease ran out.
     *
     * @return 1 if this caller took the claim over, 0 otherwise
     */
    @Modifying
    @Query("UPDATE ProcessedEvent p SET p.createdAt = :now "
            + "WHERE p.eventKey = :eventKey AND p.completedAt IS NULL AND p.createdAt <= :leaseCutoff")
    int reclaimExpired(@Param("eventKey") String eventKey,
                       @Param("now") LocalDateTime now,
                       @Param("leaseCutoff") LocalDateTime leaseCutoff);

    @Modifying
    @Query("UPDATE ProcessedEvent p SET p.completedAt = :completedAt WHERE p.eventKey = :eventKey")
    int markCompleted(@Param("eventKey") String eventKey, @Param("completedAt") LocalDateTime completedAt);

    @Modifying
    @Query("DELETE FROM ProcessedEvent p WHERE p.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
