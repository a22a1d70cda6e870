package com.medsuy.appointmentservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class AvailableSlotResponse {
    private Long id;
    private LocalDateTime datetime;
    private String branch;
    private String room;
    private String doctor;
    private String specialty;
}
