package com.medsuy.appointmentservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * medsuy.outbox.* settings: publishing of notification events and the local spool
 * used when the broker is unreachable.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "medsuy.outbox")
public class OutboxProperties {

    /** How long a publish waits for the broker confirm. */
    private Duration confirmTimeout = Duration.ofSeconds(5);

    /** Spooled events are given up (marked failed) after this many publish attempts. */
    private int maxAttempts = 10;

    private int publisherCorePoolSize = 2;
    private int publisherMaxPoolSize = 4;
    private int publisherQueueCapacity = 500;
}
