package com.medsuy.appointmentservice.mapper;

import com.medsuy.appointmentservice.dto.AppointmentResponse;
import com.medsuy.appointmentservice.dto.AvailableSlotResponse;
import com.medsuy.appointmentservice.model.Slot;
import org.springframework.stereotype.Component;

@Component
public class SlotMapper {

    public AvailableSlotResponse toAvailableSlotResponse(Slot slot) {
        return AvailableSlotResponse.builder()
                .id(slot.getId())
                .datetime(slot.getScheduledAt())
                .branch(slot.getBranch().getName())
                .room(slot.getRoom())
                .doctor(slot.getDoctor().getFullName())
                .specialty(slot.getSpecialty())
                .build();
    }

    public AppointmentResponse toAppointmentResponse(Slot slot) {
        return AppointmentResponse.builder()
                .id(slot.getId())
                .doctor(slot.getDoctor().getFullName())
                .specialty(slot.getSpecialty())
                .datetime(slot.getScheduledAt())
                .branch(slot.getBranch().getName())
                .room(slot.getRoom())
                .status("confirmed")
                .build();
    }
}
