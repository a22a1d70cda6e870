package com.medsuy.notificationservice.config;

import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential back-off with random jitter that never gives up.
 *
 * Used as the listener container's recovery back-off: after a broker outage every
 * consumer instance reconnects at a slightly different moment.
 */
public class JitteredExponentialBackOff implements BackOff {

    private final long initialIntervalMs;
    private final double multiplier;
    private final long maxIntervalMs;
    private final double jitter;
    private final DoubleSupplier random;

    public JitteredExponentialBackOff(Duration initialInterval, double multiplier, Duration maxInterval, double jitter) {
        this(initialInterval, multiplier, maxInterval, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    JitteredExponentialBackOff(Duration initialInterval, double multiplier, Duration maxInterval, double jitter,
            DoubleSupplier random) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
        }
        this.initialIntervalMs = initialInterval.toMillis();
        this.multiplier = multiplier;
        this.maxIntervalMs = maxInterval.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public BackOffExecution start() {
        return new Execution();
    }

    private class Execution implements BackOffExecution {

        private double currentIntervalMs = initialIntervalMs;

        @Override
        public long nextBackOff() {
            long base = (long) Math.min(currentIntervalMs, maxIntervalMs);
            currentIntervalMs = Math.min(currentIntervalMs * multiplier, maxIntervalMs);

            // random factor in [1 - jitter, 1 + jitter]
            double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
            return Math.max(0L, Math.round(base * factor));
        }

        @Override
        public String toString() {
            return "JitteredExponentialBackOff{currentIntervalMs=" + currentIntervalMs + "}";
        }
    }
}
