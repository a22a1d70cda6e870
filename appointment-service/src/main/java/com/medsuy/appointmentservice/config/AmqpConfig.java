package com.medsuy.appointmentservice.config;

import org.springframework.amqp.core.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.medsuy.common.messaging.NotificationTopology.*;

/**
 * RabbitMQ topology needed by the producer side.
 *
 * The notification queue is declared here as well, so events published before the
 * notification-service has ever started are not dropped as unroutable.
 */
@Configuration
public class AmqpConfig {

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
}
