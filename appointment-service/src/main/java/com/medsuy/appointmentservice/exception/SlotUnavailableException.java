package com.medsuy.appointmentservice.exception;

/**
 * Exception thrown when a slot is already reserved by someone
 * The caller may pick another slot; retrying the same one will not help.
 * HTTP Status: 409 Conflict
 */
public class SlotUnavailableException extends RuntimeException {

    public SlotUnavailableException(Long slotId) {
        super("Appointment slot is no longer available: " + slotId);
    }
}
