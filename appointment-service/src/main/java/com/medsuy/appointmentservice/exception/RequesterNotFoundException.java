package com.medsuy.appointmentservice.exception;

import com.medsuy.common.exception.ResourceNotFoundException;

/**
 * Requester does not exist or is not active.
 * HTTP Status: 404 Not Found
 */
public class RequesterNotFoundException extends ResourceNotFoundException {

    public RequesterNotFoundException(Long requesterId) {
        super("Patient not found: " + requesterId);
    }
}
