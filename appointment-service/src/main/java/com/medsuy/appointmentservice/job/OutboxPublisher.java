package com.medsuy.appointmentservice.job;

import com.medsuy.appointmentservice.config.OutboxProperties;
import com.medsuy.appointmentservice.messaging.NotificationEventSender;
import com.medsuy.appointmentservice.model.OutboxEvent;
import com.medsuy.appointmentservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Re-sends events spooled while the broker was unreachable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  private final OutboxRepository outboxRepository;
  private final NotificationEventSender sender;
  private final OutboxProperties properties;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${medsuy.outbox.poll-interval-ms:5000}")
  @Transactional
  public void publishOutboxEvents() {
    // Oldest first, batches of 50; rows locked by another instance are skipped
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc();

    if (events.isEmpty()) {
      return;
    }

    log.debug("Found {} spooled outbox events to publish", events.size());

    for (OutboxEvent event : events) {
      try {
        sender.send(event.getType(), event.getMessageId(), event.getPayload());

        // Soft Delete: Mark as processed instead of hard delete
        event.setProcessed(true);
        outboxRepository.save(event);

        log.info("Published spooled outbox event: id={}, messageId={}, attempts={}",
            event.getId(), event.getMessageId(), event.getAttempts() + 1);

      } catch (Exception e) {
        event.setAttempts(event.getAttempts() + 1);
        event.setLastError(e.getClass().getSimpleName() + ": " + e.getMessage());

        if (event.getAttempts() >= properties.getMaxAttempts()) {
          event.setFailed(true);
          log.error("CRITICAL: Giving up on outbox event after {} attempts, notification lost: id={}, messageId={}, payload={}",
              event.getAttempts(), event.getId(), event.getMessageId(), event.getPayload(), e);
        } else {
          log.warn("Failed to publish outbox event, will retry: id={}, messageId={}, attempts={}, error={}",
              event.getId(), event.getMessageId(), event.getAttempts(), e.getMessage());
        }
        outboxRepository.save(event);
      }
    }
  }

  // Cleanup Job: Delete processed events older than 24 hours
  // Runs every day at 3 AM
  @Scheduled(cron = "0 0 3 * * *")
  @Transactional
  public void cleanupProcessedEvents() {
    LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(1);
    log.info("Starting cleanup of processed outbox events older than {}", cutoff);

    int totalDeleted = 0;
    while (true) {
      List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
      if (batch.isEmpty()) {
        break;
      }
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
      log.debug("Deleted batch of {} processed events", batch.size());
    }

    log.info("Cleanup completed. Total deleted: {}", totalDeleted);
  }
}
