package com.medsuy.appointmentservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReserveAppointmentRequest {

    @NotNull(message = "slotId is required")
    @Positive(message = "slotId must be positive")
    private Long slotId;
}
