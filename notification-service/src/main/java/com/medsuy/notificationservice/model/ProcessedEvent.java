package com.medsuy.notificationservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Dedup record for delivered (or in-flight) notification events.
 *
 * A row with completedAt == null is a claim held by a consumer that is still sending.
 */
@Entity
@Table(name = "processed_events", indexes = {
        @Index(name = "idx_processed_events_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class ProcessedEvent {

    @Id
    @Column(name = "event_key", nullable = false, length = 100)
    private String eventKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public ProcessedEvent(String eventKey, LocalDateTime createdAt) {
        this.eventKey = eventKey;
        this.createdAt = createdAt;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }
}
