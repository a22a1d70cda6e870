package com.medsuy.appointmentservice.exception;

import com.medsuy.common.exception.ResourceNotFoundException;

/**
 * HTTP Status: 404 Not Found
 */
public class SlotNotFoundException extends ResourceNotFoundException {

    public SlotNotFoundException(Long slotId) {
        super("Appointment slot not found: " + slotId);
    }
}
