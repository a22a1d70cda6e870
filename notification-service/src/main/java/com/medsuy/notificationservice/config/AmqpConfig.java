package com.medsuy.notificationservice.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.medsuy.common.messaging.NotificationTopology.*;

/**
 * RabbitMQ configuration for notification service.
 *
 * q.notifications          main queue, dead-letters rejected messages to q.notifications.dlq
 * q.notifications.retry    holding queue: messages sit there until their per-message TTL
 *                          expires, then are dead-lettered back onto the main queue
 */
@Configuration
public class AmqpConfig {

    public static final String MANUAL_ACK_CONTAINER_FACTORY = "manualAckContainerFactory";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return QueueBuilder.durable(DLQ_NAME).build();
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with(DLQ_ROUTING_KEY);
    }

    @Bean
    public TopicExchange appointmentEventsExchange() {
        return new TopicExchange(APPOINTMENT_EXCHANGE);
    }

    // Must stay identical to the declaration in appointment-service
    @Bean
    public Queue notificationsQueue() {
        return QueueBuilder.durable(Q_NOTIFICATIONS)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }

    @Bean
    public Binding appointmentReservedBinding(Queue notificationsQueue, TopicExchange appointmentEventsExchange) {
        return BindingBuilder.bind(notificationsQueue).to(appointmentEventsExchange)
                .with(ROUTING_KEY_APPOINTMENT_RESERVED);
    }

    @Bean
    public DirectExchange retryExchange() {
        return new DirectExchange(RETRY_EXCHANGE);
    }

    @Bean
    public Queue notificationsRetryQueue() {
        return QueueBuilder.durable(Q_NOTIFICATIONS_RETRY)
                .withArgument("x-dead-letter-exchange", APPOINTMENT_EXCHANGE)
                .withArgument("x-dead-letter-routing-key", ROUTING_KEY_APPOINTMENT_RESERVED)
                .build();
    }

    @Bean
    public Binding notificationsRetryBinding(Queue notificationsRetryQueue, DirectExchange retryExchange) {
        return BindingBuilder.bind(notificationsRetryQueue).to(retryExchange).with(ROUTING_KEY_APPOINTMENT_RESERVED);
    }

    /**
     * Manual acknowledgment: the subscriber acks only after the email was sent (or the
     * message was deliberately dropped / rescheduled). Rejected messages are never
     * requeued by the container itself.
     */
    @Bean(name = MANUAL_ACK_CONTAINER_FACTORY)
    public SimpleRabbitListenerContainerFactory manualAckContainerFactory(
            ConnectionFactory connectionFactory,
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            NotificationProperties properties) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);

        NotificationProperties.Listener listener = properties.getListener();
        NotificationProperties.Recovery recovery = properties.getRecovery();

        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setPrefetchCount(listener.getPrefetch());
        factory.setConcurrentConsumers(listener.getConcurrency());
        factory.setMaxConcurrentConsumers(listener.getMaxConcurrency());
        factory.setDefaultRequeueRejected(false);
        // Keep retrying when the broker or queue is not there yet; never stop the container
        factory.setMissingQueuesFatal(false);
        factory.setRecoveryBackOff(new JitteredExponentialBackOff(
                recovery.getInitialInterval(),
                recovery.getMultiplier(),
                recovery.getMaxInterval(),
                recovery.getJitter()));
        return factory;
    }
}
