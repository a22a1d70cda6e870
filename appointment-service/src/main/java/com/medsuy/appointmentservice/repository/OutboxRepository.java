package com.medsuy.appointmentservice.repository;

import com.medsuy.appointmentservice.model.OutboxEvent;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {
  // Fetch only the oldest 50 pending events to avoid memory issues.
  // FOR UPDATE SKIP LOCKED (lock timeout -2) so several instances don't re-send the same rows
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
  List<OutboxEvent> findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc();

  // Fetch processed events for batch deletion
  List<OutboxEvent> findTop1000ByProcessedTrueAndCreatedAtBefore(LocalDateTime cutoff);
}
