package com.medsuy.notificationservice.subscriber;

import com.medsuy.notificationservice.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.MessagePropertiesBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import static com.medsuy.common.messaging.NotificationTopology.*;

/**
 * Parks a failed message on the retry queue. When its TTL expires the broker
 * dead-letters it back onto the main notifications queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationRetryScheduler {

    private final RabbitTemplate rabbitTemplate;
    private final NotificationProperties properties;

    @Value("${medsuy.notification.retry.confirm-timeout-ms:5000}")
    private long confirmTimeoutMs = 5000;

    /**
     * @param original    the delivery that just failed
     * @param nextAttempt attempt number the redelivery will carry
     * @throws org.springframework.amqp.AmqpException if the broker did not confirm the republish
     */
    public void scheduleRetry(Message original, int nextAttempt) {
        long delayMs = delayBeforeAttempt(nextAttempt);

        MessageProperties retryProperties = MessagePropertiesBuilder
                .fromClonedProperties(original.getMessageProperties())
                .setHeader(HEADER_DELIVERY_ATTEMPT, nextAttempt)
                .setExpiration(String.valueOf(delayMs))
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .build();
        Message retry = MessageBuilder.withBody(original.getBody()).andProperties(retryProperties).build();

        rabbitTemplate.invoke(ops -> {
            ops.send(RETRY_EXCHANGE, ROUTING_KEY_APPOINTMENT_RESERVED, retry);
            ops.waitForConfirmsOrDie(confirmTimeoutMs);
            return null;
        });

        log.debug("Retry scheduled: messageId={}, attempt={}, delayMs={}",
                retryProperties.getMessageId(), nextAttempt, delayMs);
    }

    /**
     * initialDelay * multiplier^(attempt - 2), capped at maxDelay. Attempt 2 is the first retry.
     */
    long delayBeforeAttempt(int attempt) {
        NotificationProperties.Retry retry = properties.getRetry();
        double delay = retry.getInitialDelay().toMillis() * Math.pow(retry.getMultiplier(), Math.max(0, attempt - 2));
        return (long) Math.min(delay, retry.getMaxDelay().toMillis());
    }
}
