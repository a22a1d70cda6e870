package com.medsuy.appointmentservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CancellationResponse {
    private String message;
    private Long slotId;
}
