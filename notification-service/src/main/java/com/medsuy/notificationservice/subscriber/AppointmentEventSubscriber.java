package com.medsuy.notificationservice.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medsuy.common.contracts.AppointmentReservedContract;
import com.medsuy.notificationservice.config.AmqpConfig;
import com.medsuy.notificationservice.config.NotificationProperties;
import com.medsuy.notificationservice.service.AppointmentEmailComposer;
import com.medsuy.notificationservice.service.AppointmentEmailComposer.EmailContent;
import com.medsuy.notificationservice.service.EmailSender;
import com.medsuy.notificationservice.service.ProcessedEventService;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;

import static com.medsuy.common.messaging.NotificationTopology.HEADER_DELIVERY_ATTEMPT;
import static com.medsuy.common.messaging.NotificationTopology.Q_NOTIFICATIONS;

/**
 * Consumes appointment events and sends the confirmation email.
 *
 * Acknowledgment is manual. Each delivery ends in exactly one of:
 * - ack: delivered, duplicate, unusable payload, or parked on the retry queue
 * - nack without requeue: permanent delivery failure or retries exhausted (goes to the DLQ)
 * - nack with requeue: the retry could not be scheduled
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AppointmentEventSubscriber {

    static final String EVENT_KEY_PREFIX = "APPOINTMENT_RESERVED:";

    private final ObjectMapper objectMapper;
    private final ProcessedEventService processedEventService;
    private final AppointmentEmailComposer emailComposer;
    private final EmailSender emailSender;
    private final NotificationRetryScheduler retryScheduler;
    private final NotificationProperties properties;

    @RabbitListener(queues = Q_NOTIFICATIONS, containerFactory = AmqpConfig.MANUAL_ACK_CONTAINER_FACTORY)
    public void onMessage(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        String messageId = message.getMessageProperties().getMessageId();

        AppointmentReservedContract event = readEvent(message);
        if (event == null) {
            channel.basicAck(deliveryTag, false);
            return;
        }

        if (!AppointmentReservedContract.TYPE.equals(event.getType())) {
            log.warn("Unknown event type, dropping: messageId={}, type={}", messageId, event.getType());
            channel.basicAck(deliveryTag, false);
            return;
        }

        if (!StringUtils.hasText(event.getDestinationAddress())) {
            log.info("No email address for requester, skipping notification: eventId={}, requesterId={}",
                    event.getEventId(), event.getRequesterId());
            channel.basicAck(deliveryTag, false);
            return;
        }

        int attempt = deliveryAttempt(message);
        String eventKey = EVENT_KEY_PREFIX + event.getEventId();

        boolean acquired;
        try {
            acquired = processedEventService.tryAcquire(eventKey);
        } catch (RuntimeException e) {
            // Dedup store unavailable: handle like any other transient failure
            handleTransientFailure(message, channel, event, attempt, e);
            return;
        }
        if (!acquired) {
            log.warn("Event already processed, skipping: eventKey={}", eventKey);
            channel.basicAck(deliveryTag, false);
            return;
        }

        try {
            EmailContent email = emailComposer.composeReservationConfirmation(event);
            emailSender.send(event.getDestinationAddress(), email.getSubject(), email.getHtmlBody());
        } catch (MailParseException | MailAuthenticationException | MailPreparationException e) {
            releaseQuietly(eventKey);
            log.error("Permanent delivery failure, dead-lettering: eventId={}, attempt={}, error={}",
                    event.getEventId(), attempt, e.getMessage(), e);
            channel.basicNack(deliveryTag, false, false);
            return;
        } catch (RuntimeException e) {
            releaseQuietly(eventKey);
            handleTransientFailure(message, channel, event, attempt, e);
            return;
        }

        try {
            processedEventService.markCompleted(eventKey);
        } catch (RuntimeException e) {
            // The claim row still exists, so duplicates stay blocked until its lease runs out
            log.error("Email sent but completion not recorded: eventKey={}, error={}", eventKey, e.getMessage());
        }
        channel.basicAck(deliveryTag, false);
        log.info("Reservation confirmation sent: eventId={}, slotId={}, attempt={}",
                event.getEventId(), event.getSlotId(), attempt);
    }

    private AppointmentReservedContract readEvent(Message message) {
        String messageId = message.getMessageProperties().getMessageId();
        AppointmentReservedContract event;
        try {
            event = objectMapper.readValue(message.getBody(), AppointmentReservedContract.class);
        } catch (IOException e) {
            log.error("Unreadable message, dropping: messageId={}, error={}", messageId, e.getMessage());
            return null;
        }
        if (event == null || event.getEventId() == null || !StringUtils.hasText(event.getType())) {
            log.error("Message without event_id or type, dropping: messageId={}", messageId);
            return null;
        }
        return event;
    }

    private void handleTransientFailure(Message message, Channel channel, AppointmentReservedContract event,
            int attempt, Exception cause) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();

        if (attempt >= properties.getMaxAttempts()) {
            log.error("Delivery failed {} times, dead-lettering: eventId={}, error={}",
                    attempt, event.getEventId(), cause.getMessage(), cause);
            channel.basicNack(deliveryTag, false, false);
            return;
        }

        try {
            retryScheduler.scheduleRetry(message, attempt + 1);
        } catch (AmqpException e) {
            log.error("Could not schedule retry, requeueing: eventId={}, error={}",
                    event.getEventId(), e.getMessage());
            channel.basicNack(deliveryTag, false, true);
            return;
        }
        channel.basicAck(deliveryTag, false);
        log.warn("Transient delivery failure, retry {} of {} scheduled: eventId={}, error={}",
                attempt + 1, properties.getMaxAttempts(), event.getEventId(), cause.getMessage());
    }

    private void releaseQuietly(String eventKey) {
        try {
            processedEventService.release(eventKey);
        } catch (RuntimeException e) {
            log.error("Could not release idempotency key, redelivery waits for its lease: eventKey={}, error={}",
                    eventKey, e.getMessage());
        }
    }

    static int deliveryAttempt(Message message) {
        Object header = message.getMessageProperties().getHeader(HEADER_DELIVERY_ATTEMPT);
        if (header instanceof Number number) {
            return Math.max(1, number.intValue());
        }
        if (header != null) {
            try {
                return Math.max(1, Integer.parseInt(header.toString()));
            } catch (NumberFormatException e) {
                log.warn("Invalid {} header '{}', assuming first attempt", HEADER_DELIVERY_ATTEMPT, header);
            }
        }
        return 1;
    }
}
