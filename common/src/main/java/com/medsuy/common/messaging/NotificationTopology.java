package com.medsuy.common.messaging;

/**
 * RabbitMQ names shared by the producer (appointment-service) and the consumer
 * (notification-service). Both sides declare the main queue, so its arguments must match.
 */
public final class NotificationTopology {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.notifications.dlq";
    public static final String DLQ_ROUTING_KEY = "notifications.dlq";

    public static final String APPOINTMENT_EXCHANGE = "appointment_events_exchange";
    public static final String Q_NOTIFICATIONS = "q.notifications";
    public static final String ROUTING_KEY_APPOINTMENT_RESERVED = "appointment.reserved";

    public static final String RETRY_EXCHANGE = "appointment_events_retry_exchange";
    public static final String Q_NOTIFICATIONS_RETRY = "q.notifications.retry";

    public static final String HEADER_DELIVERY_ATTEMPT = "x-delivery-attempt";

    private NotificationTopology() {
    }
}
