package com.medsuy.appointmentservice.job;

import com.medsuy.appointmentservice.config.OutboxProperties;
import com.medsuy.appointmentservice.messaging.NotificationEventSender;
import com.medsuy.appointmentservice.model.OutboxEvent;
import com.medsuy.appointmentservice.repository.OutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPublisher Unit Tests")
class OutboxPublisherTest {

  @Mock
  private OutboxRepository outboxRepository;
  @Mock
  private NotificationEventSender sender;

  private OutboxPublisher outboxPublisher;

  @BeforeEach
  void setUp() {
    OutboxProperties properties = new OutboxProperties();
    properties.setMaxAttempts(3);
    outboxPublisher = new OutboxPublisher(outboxRepository, sender, properties, Clock.systemDefaultZone());
  }

  private OutboxEvent spooled(int attempts) {
    return OutboxEvent.builder()
        .id(UUID.randomUUID())
        .aggregateType("SLOT")
        .aggregateId("42")
        .type("appointment.reserved")
        .messageId("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f")
        .payload("{\"event_id\":\"7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f\"}")
        .createdAt(LocalDateTime.now().minusMinutes(1))
        .attempts(attempts)
        .build();
  }

  @Test
  @DisplayName("should re-send spooled event with its original message id and mark it processed")
  void shouldResendAndMarkProcessed() {
    // Arrange
    OutboxEvent event = spooled(1);
    when(outboxRepository.findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc()).thenReturn(List.of(event));

    // Act
    outboxPublisher.publishOutboxEvents();

    // Assert
    verify(sender).send("appointment.reserved", "7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f", event.getPayload());
    assertThat(event.isProcessed()).isTrue();
    assertThat(event.isFailed()).isFalse();
    verify(outboxRepository).save(event);
  }

  @Test
  @DisplayName("should count the attempt and keep the event pending when the broker is still down")
  void shouldKeepEventPendingOnFailure() {
    // Arrange
    OutboxEvent event = spooled(1);
    when(outboxRepository.findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc()).thenReturn(List.of(event));
    doThrow(new AmqpException("no confirm")).when(sender).send(anyString(), anyString(), anyString());

    // Act
    outboxPublisher.publishOutboxEvents();

    // Assert
    assertThat(event.getAttempts()).isEqualTo(2);
    assertThat(event.isProcessed()).isFalse();
    assertThat(event.isFailed()).isFalse();
    assertThat(event.getLastError()).contains("no confirm");
    verify(outboxRepository).save(event);
  }

  @Test
  @DisplayName("should give up after max attempts")
  void shouldMarkFailedAfterMaxAttempts() {
    // Arrange
    OutboxEvent event = spooled(2);
    when(outboxRepository.findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc()).thenReturn(List.of(event));
    doThrow(new AmqpException("no confirm")).when(sender).send(anyString(), anyString(), anyString());

    // Act
    outboxPublisher.publishOutboxEvents();

    // Assert
    assertThat(event.getAttempts()).isEqualTo(3);
    assertThat(event.isFailed()).isTrue();
    assertThat(event.isProcessed()).isFalse();
  }

  @Test
  @DisplayName("should keep going with the batch after one event fails")
  void shouldContinueBatchAfterFailure() {
    // Arrange
    OutboxEvent failing = spooled(1);
    failing.setMessageId("first");
    OutboxEvent succeeding = spooled(1);
    succeeding.setMessageId("second");
    when(outboxRepository.findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc())
        .thenReturn(List.of(failing, succeeding));
    doThrow(new AmqpException("no confirm")).doNothing()
        .when(sender).send(anyString(), anyString(), anyString());

    // Act
    outboxPublisher.publishOutboxEvents();

    // Assert
    assertThat(failing.isProcessed()).isFalse();
    assertThat(succeeding.isProcessed()).isTrue();
  }

  @Test
  @DisplayName("should do nothing when the spool is empty")
  void shouldDoNothingWhenEmpty() {
    when(outboxRepository.findTop50ByProcessedFalseAndFailedFalseOrderByCreatedAtAsc()).thenReturn(List.of());

    outboxPublisher.publishOutboxEvents();

    verifyNoInteractions(sender);
    verify(outboxRepository, never()).save(any());
  }
}
