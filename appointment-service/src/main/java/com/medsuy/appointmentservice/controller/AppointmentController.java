package com.medsuy.appointmentservice.controller;

import com.medsuy.appointmentservice.dto.AppointmentResponse;
import com.medsuy.appointmentservice.dto.AvailableSlotResponse;
import com.medsuy.appointmentservice.dto.CancellationResponse;
import com.medsuy.appointmentservice.dto.ReservationResponse;
import com.medsuy.appointmentservice.dto.ReserveAppointmentRequest;
import com.medsuy.appointmentservice.dto.SlotSearchCriteria;
import com.medsuy.appointmentservice.service.AppointmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/patient")
@RequiredArgsConstructor
public class AppointmentController {

    private final AppointmentService appointmentService;

    /**
     * Lists available slots ordered by date.
     * All filters are optional; specialty matches as a case-insensitive substring.
     */
    @GetMapping("/appointments/available")
    public ResponseEntity<List<AvailableSlotResponse>> getAvailable(
            @RequestParam(name = "specialty", required = false) String specialty,
            @RequestParam(name = "doctorId", required = false) Long doctorId,
            @RequestParam(name = "branchId", required = false) Long branchId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {

        SlotSearchCriteria criteria = SlotSearchCriteria.builder()
                .specialty(specialty)
                .doctorId(doctorId)
                .branchId(branchId)
                .from(from)
                .to(to)
                .build();
        return ResponseEntity.ok(appointmentService.findAvailable(criteria));
    }

    @GetMapping("/{patientId}/appointments/upcoming")
    public ResponseEntity<List<AppointmentResponse>> getUpcoming(@PathVariable("patientId") Long patientId) {
        return ResponseEntity.ok(appointmentService.findUpcoming(patientId));
    }

    /**
     * Reserves a slot. Returns 201 as soon as the reservation is committed; the
     * confirmation email is sent asynchronously.
     */
    @PostMapping("/{patientId}/appointments/reserve")
    public ResponseEntity<ReservationResponse> reserve(
            @PathVariable("patientId") Long patientId,
            @Valid @RequestBody ReserveAppointmentRequest request) {
        Long slotId = appointmentService.claim(patientId, request.getSlotId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ReservationResponse.builder()
                        .message("Appointment reserved")
                        .slotId(slotId)
                        .build());
    }

    @PostMapping("/{patientId}/appointments/{slotId}/cancel")
    public ResponseEntity<CancellationResponse> cancel(
            @PathVariable("patientId") Long patientId,
            @PathVariable("slotId") Long slotId) {
        appointmentService.release(patientId, slotId);
        return ResponseEntity.ok(CancellationResponse.builder()
                .message("Appointment cancelled")
                .slotId(slotId)
                .build());
    }
}
