package com.medsuy.appointmentservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that runs broker publishes off the request thread.
 * Bounded queue: when it is full the publisher spools the event instead of blocking.
 */
@Configuration
public class AsyncConfig {

    public static final String NOTIFICATION_PUBLISHER_EXECUTOR = "notificationPublisherExecutor";

    @Bean(name = NOTIFICATION_PUBLISHER_EXECUTOR)
    public ThreadPoolTaskExecutor notificationPublisherExecutor(OutboxProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPublisherCorePoolSize());
        executor.setMaxPoolSize(properties.getPublisherMaxPoolSize());
        executor.setQueueCapacity(properties.getPublisherQueueCapacity());
        executor.setThreadNamePrefix("notif-publisher-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
