package com.medsuy.appointmentservice.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Domain event raised inside the claim transaction.
 * Display fields are captured while the slot is still locked; the event is only
 * forwarded to RabbitMQ by a @TransactionalEventListener AFTER the transaction commits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentReservedEvent {
    private UUID eventId;
    private Long requesterId;
    private Long slotId;
    private String doctor;
    private String specialty;
    private LocalDateTime scheduledAt;
    private String branch;
    private String destinationAddress;
    private Instant occurredAt;
}
