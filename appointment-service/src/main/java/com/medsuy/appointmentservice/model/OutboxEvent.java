package com.medsuy.appointmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Spooled notification event whose direct publish after commit failed.
 * Re-sent by {@link com.medsuy.appointmentservice.job.OutboxPublisher}.
 */
@Entity
@Table(name = "outbox")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String aggregateType;

  @Column(nullable = false)
  private String aggregateId;

  @Column(nullable = false)
  private String type; // Event type (routing key)

  @Column(nullable = false)
  private String messageId; // eventId of the contract, kept stable across re-sends

  @Column(columnDefinition = "jsonb", nullable = false)
  @JdbcTypeCode(SqlTypes.JSON)
  private String payload;

  @Column(nullable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private int attempts;

  @Column(length = 1000)
  private String lastError;

  @Column(nullable = false)
  private boolean processed;

  @Column(nullable = false)
  private boolean failed; // gave up after max attempts
}
