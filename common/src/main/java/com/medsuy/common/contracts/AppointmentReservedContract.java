package com.medsuy.common.contracts;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Message published once per committed slot reservation.
 * Serialized with snake_case keys, e.g. {@code requester_id}, {@code destination_address}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AppointmentReservedContract {

    public static final String TYPE = "appointment_reserved";

    private UUID eventId; // dedup key on the consumer side
    private String type;
    private Long requesterId;
    private Long slotId;
    private String doctor;
    private String specialty;
    private LocalDateTime datetime;
    private String branch;
    private String destinationAddress; // may be null, consumer skips delivery
    private Instant occurredAt;
}
