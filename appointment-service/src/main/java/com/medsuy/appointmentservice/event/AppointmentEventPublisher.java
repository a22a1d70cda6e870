package com.medsuy.appointmentservice.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medsuy.appointmentservice.config.AsyncConfig;
import com.medsuy.appointmentservice.messaging.NotificationEventSender;
import com.medsuy.common.contracts.AppointmentReservedContract;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import static com.medsuy.common.messaging.NotificationTopology.ROUTING_KEY_APPOINTMENT_RESERVED;

/**
 * Publishes domain events to RabbitMQ after database transaction commits.
 * Ensures messages are only sent if the transaction succeeds.
 *
 * The broker round trip runs on the publisher executor, so the HTTP response never
 * waits for it. When the broker is unreachable (or the executor is saturated) the
 * event goes to the outbox spool instead; nothing is thrown back to the caller.
 */
@Component
@Slf4j
public class AppointmentEventPublisher {

    private final NotificationEventSender sender;
    private final OutboxSpool outboxSpool;
    private final ObjectMapper objectMapper;
    private final TaskExecutor executor;

    public AppointmentEventPublisher(NotificationEventSender sender,
            OutboxSpool outboxSpool,
            ObjectMapper objectMapper,
            @Qualifier(AsyncConfig.NOTIFICATION_PUBLISHER_EXECUTOR) TaskExecutor executor) {
        this.sender = sender;
        this.outboxSpool = outboxSpool;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAppointmentReserved(AppointmentReservedEvent event) {
        AppointmentReservedContract contract = toContract(event);

        String payload;
        try {
            payload = objectMapper.writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            log.error("CRITICAL: Could not serialize appointment.reserved event, notification lost: eventId={}, slotId={}",
                    event.getEventId(), event.getSlotId(), e);
            return;
        }

        try {
            executor.execute(() -> publish(contract, payload));
        } catch (TaskRejectedException e) {
            log.warn("Publisher executor saturated, spooling event: eventId={}, slotId={}",
                    contract.getEventId(), contract.getSlotId());
            spool(contract, payload, e);
        }
    }

    void publish(AppointmentReservedContract contract, String payload) {
        try {
            sender.send(ROUTING_KEY_APPOINTMENT_RESERVED, contract.getEventId().toString(), payload);
            log.info("'appointment.reserved' event sent to RabbitMQ: eventId={}, slotId={}, requesterId={}",
                    contract.getEventId(), contract.getSlotId(), contract.getRequesterId());
        } catch (Exception e) {
            log.error("ERROR occurred while sending event to RabbitMQ, spooling for retry: eventId={}, slotId={}, error={}",
                    contract.getEventId(), contract.getSlotId(), e.getMessage());
            spool(contract, payload, e);
        }
    }

    private void spool(AppointmentReservedContract contract, String payload, Exception cause) {
        try {
            outboxSpool.spool(contract.getSlotId().toString(), ROUTING_KEY_APPOINTMENT_RESERVED,
                    contract.getEventId().toString(), payload, cause);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to spool appointment.reserved event, notification lost: eventId={}, payload={}",
                    contract.getEventId(), payload, e);
        }
    }

    private AppointmentReservedContract toContract(AppointmentReservedEvent event) {
        return AppointmentReservedContract.builder()
                .eventId(event.getEventId())
                .type(AppointmentReservedContract.TYPE)
                .requesterId(event.getRequesterId())
                .slotId(event.getSlotId())
                .doctor(event.getDoctor())
                .specialty(event.getSpecialty())
                .datetime(event.getScheduledAt())
                .branch(event.getBranch())
                .destinationAddress(event.getDestinationAddress())
                .occurredAt(event.getOccurredAt())
                .build();
    }
}
