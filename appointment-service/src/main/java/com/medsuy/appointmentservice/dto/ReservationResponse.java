package com.medsuy.appointmentservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReservationResponse {
    private String message;
    private Long slotId;
}
