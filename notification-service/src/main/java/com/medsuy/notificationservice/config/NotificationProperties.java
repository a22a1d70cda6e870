package com.medsuy.notificationservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * medsuy.notification.* settings.
 *
 * Example:
 * medsuy:
 *   notification:
 *     max-attempts: 5
 *     retry:
 *       initial-delay: 5s
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "medsuy.notification")
public class NotificationProperties {

    /** Delivery attempts (first try included) before a message is dead-lettered. */
    private int maxAttempts = 5;

    /** Processed event ids are remembered this long for duplicate detection. */
    private Duration dedupWindow = Duration.ofDays(7);

    /**
     * A claimed but never completed event id is considered abandoned (consumer died
     * mid-send) after this long, and may be claimed again.
     */
    private Duration claimLease = Duration.ofMinutes(5);

    private Retry retry = new Retry();
    private Recovery recovery = new Recovery();
    private Listener listener = new Listener();
    private Mail mail = new Mail();

    /** Delay before a failed delivery is redelivered: initial * multiplier^(attempt-2), capped; attempt 2 is the first retry. */
    @Getter
    @Setter
    public static class Retry {
        private Duration initialDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);
    }

    /** Reconnect back-off of the listener container when the broker is unreachable. */
    @Getter
    @Setter
    public static class Recovery {
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(60);
        private double jitter = 0.5; // +/- fraction of the computed interval
    }

    @Getter
    @Setter
    public static class Listener {
        private int prefetch = 10;
        private int concurrency = 1;
        private int maxConcurrency = 4;
    }

    @Getter
    @Setter
    public static class Mail {
        private String from = "no-reply@medsuy.com";
        private String reservationSubject = "Confirmación de reserva - MedSUY";
    }
}
