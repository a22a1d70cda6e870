package com.medsuy.appointmentservice.exception;

/**
 * Exception thrown when the slot row lock could not be acquired within the configured
 * lock timeout. Nothing was changed; the same request can be resubmitted.
 * HTTP Status: 503 Service Unavailable
 */
public class SlotLockTimeoutException extends RuntimeException {

    public SlotLockTimeoutException(Long slotId, Throwable cause) {
        super("Timed out waiting for appointment slot " + slotId + ", please retry", cause);
    }
}
