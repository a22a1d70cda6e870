package com.medsuy.appointmentservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Optional filters of the available-slots query; null fields are not applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotSearchCriteria {
    private String specialty; // case-insensitive substring
    private Long doctorId;
    private Long branchId;
    private LocalDateTime from;
    private LocalDateTime to;
}
