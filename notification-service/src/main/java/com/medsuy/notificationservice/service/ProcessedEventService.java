package com.medsuy.notificationservice.service;

import com.medsuy.notificationservice.config.NotificationProperties;
import com.medsuy.notificationservice.repository.ProcessedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Idempotency keys for notification delivery.
 *
 * Every method runs in its own transaction (REQUIRES_NEW) so the key is visible to other
 * consumers immediately, independent of whatever the caller is doing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProcessedEventService {

    private final ProcessedEventRepository processedEventRepository;
    private final NotificationProperties properties;
    private final Clock clock;

    /**
     * Claims the key for processing.
     *
     * @return true if this consumer owns the key now, false if the event was already
     *         delivered or another consumer is delivering it
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean tryAcquire(String eventKey) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (processedEventRepository.insertIfAbsent(eventKey, now) == 1) {
            return true;
        }

        // Key exists: completed, in flight, or abandoned by a consumer that died mid-send
        LocalDateTime leaseCutoff = now.minus(properties.getClaimLease());
        if (processedEventRepository.reclaimExpired(eventKey, now, leaseCutoff) == 1) {
            log.warn("Reclaimed abandoned idempotency key: eventKey={}", eventKey);
            return true;
        }

        log.info("Idempotency key already held or completed: eventKey={}", eventKey);
        return false;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markCompleted(String eventKey) {
        if (processedEventRepository.markCompleted(eventKey, LocalDateTime.now(clock)) == 0) {
            log.warn("Idempotency key vanished before completion: eventKey={}", eventKey);
        }
    }

    /**
     * Drops the claim so a redelivery of the same event is processed again.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(String eventKey) {
        processedEventRepository.deleteById(eventKey);
    }

    @Transactional
    public int deleteOlderThan(LocalDateTime cutoff) {
        return processedEventRepository.deleteCreatedBefore(cutoff);
    }
}
