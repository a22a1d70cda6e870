package com.medsuy.appointmentservice.model;

public enum SlotStatus {
    AVAILABLE,
    RESERVED
}
