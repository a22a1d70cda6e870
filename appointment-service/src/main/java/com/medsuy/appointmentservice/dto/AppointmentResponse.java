package com.medsuy.appointmentservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A reserved slot as seen by its holder.
 */
@Data
@Builder
public class AppointmentResponse {
    private Long id;
    private String doctor;
    private String specialty;
    private LocalDateTime datetime;
    private String branch;
    private String room;
    private String status; // always "confirmed" for reserved slots
}
