package com.medsuy.appointmentservice.event;

import com.medsuy.appointmentservice.model.OutboxEvent;
import com.medsuy.appointmentservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Stores events that could not be handed to the broker so the
 * {@link com.medsuy.appointmentservice.job.OutboxPublisher} can re-send them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxSpool {

    static final int MAX_ERROR_LENGTH = 1000;

    private final OutboxRepository outboxRepository;
    private final Clock clock;

    /**
     * Uses REQUIRES_NEW: this runs from after-commit callbacks, where the finished
     * claim transaction is still bound to the thread and would never flush our insert.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OutboxEvent spool(String aggregateId, String type, String messageId, String payload, Throwable cause) {
        OutboxEvent outboxEvent = OutboxEvent.builder()
                .aggregateType("SLOT")
                .aggregateId(aggregateId)
                .type(type)
                .messageId(messageId)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .attempts(1)
                .lastError(truncate(cause))
                .processed(false)
                .failed(false)
                .build();

        OutboxEvent saved = outboxRepository.save(outboxEvent);
        log.info("Spooled event to outbox for retry: messageId={}, type={}", messageId, type);
        return saved;
    }

    static String truncate(Throwable cause) {
        if (cause == null) {
            return null;
        }
        String text = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }
}
