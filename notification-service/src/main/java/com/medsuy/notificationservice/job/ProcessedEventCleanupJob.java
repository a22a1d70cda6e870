package com.medsuy.notificationservice.job;

import com.medsuy.notificationservice.config.NotificationProperties;
import com.medsuy.notificationservice.service.ProcessedEventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Forgets idempotency keys once they fall out of the dedup window.
 * A redelivery older than the window would be sent again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessedEventCleanupJob {

    private final ProcessedEventService processedEventService;
    private final NotificationProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${medsuy.notification.cleanup-cron:0 0 * * * *}")
    public void purgeExpiredKeys() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getDedupWindow());
        int deleted = processedEventService.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} idempotency keys older than {}", deleted, cutoff);
        }
    }
}
