package com.medsuy.appointmentservice.messaging;

import com.medsuy.appointmentservice.config.OutboxProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

import static com.medsuy.common.messaging.NotificationTopology.APPOINTMENT_EXCHANGE;

/**
 * Sends raw JSON events to the appointment exchange and blocks until the broker
 * confirms them (publisher confirms, spring.rabbitmq.publisher-confirm-type=simple).
 *
 * Any failure, including a missing confirm within the timeout, surfaces as a runtime
 * exception; callers decide whether to spool.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationEventSender {

    private final RabbitTemplate rabbitTemplate;
    private final OutboxProperties properties;

    public void send(String routingKey, String messageId, String jsonPayload) {
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding(StandardCharsets.UTF_8.name());
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT); // survives broker restart
        props.setMessageId(messageId);
        // Don't set __TypeId__ - consumers handle raw JSON

        Message message = new Message(jsonPayload.getBytes(StandardCharsets.UTF_8), props);
        long confirmTimeoutMs = properties.getConfirmTimeout().toMillis();

        rabbitTemplate.invoke(operations -> {
            operations.send(APPOINTMENT_EXCHANGE, routingKey, message);
            operations.waitForConfirmsOrDie(confirmTimeoutMs);
            return Boolean.TRUE;
        });

        log.debug("Broker confirmed message: messageId={}, routingKey={}", messageId, routingKey);
    }
}
