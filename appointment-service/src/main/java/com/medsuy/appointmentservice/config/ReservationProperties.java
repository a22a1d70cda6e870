package com.medsuy.appointmentservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * medsuy.reservation.* settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "medsuy.reservation")
public class ReservationProperties {

    /**
     * Maximum time a claim or release waits for the slot row lock before failing
     * with a retryable error.
     */
    private Duration lockTimeout = Duration.ofSeconds(3);
}
