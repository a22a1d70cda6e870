package com.medsuy.appointmentservice.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medsuy.appointmentservice.messaging.NotificationEventSender;
import com.medsuy.common.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.net.ConnectException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentEventPublisher Unit Tests")
class AppointmentEventPublisherTest {

  @Mock
  private NotificationEventSender sender;
  @Mock
  private OutboxSpool outboxSpool;

  private final ObjectMapper objectMapper = JacksonConfig.configure(new ObjectMapper());

  private AppointmentReservedEvent event;

  @BeforeEach
  void setUp() {
    event = AppointmentReservedEvent.builder()
        .eventId(UUID.fromString("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f"))
        .requesterId(7L)
        .slotId(42L)
        .doctor("Laura Gomez")
        .specialty("Cardiología")
        .scheduledAt(LocalDateTime.of(2026, 3, 15, 9, 30))
        .branch("Centro")
        .destinationAddress("ana@medsuy.test")
        .occurredAt(Instant.parse("2026-03-10T12:00:00Z"))
        .build();
  }

  private AppointmentEventPublisher publisherWith(TaskExecutor executor) {
    return new AppointmentEventPublisher(sender, outboxSpool, objectMapper, executor);
  }

  @Test
  @DisplayName("should send snake_case JSON with event id as message id")
  void shouldSendSnakeCaseJson() throws Exception {
    // Arrange
    AppointmentEventPublisher publisher = publisherWith(new SyncTaskExecutor());
    ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);

    // Act
    publisher.onAppointmentReserved(event);

    // Assert
    verify(sender).send(eq("appointment.reserved"), eq("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f"),
        payloadCaptor.capture());
    JsonNode json = objectMapper.readTree(payloadCaptor.getValue());
    assertThat(json.get("event_id").asText()).isEqualTo("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f");
    assertThat(json.get("type").asText()).isEqualTo("appointment_reserved");
    assertThat(json.get("requester_id").asLong()).isEqualTo(7L);
    assertThat(json.get("slot_id").asLong()).isEqualTo(42L);
    assertThat(json.get("doctor").asText()).isEqualTo("Laura Gomez");
    assertThat(json.get("specialty").asText()).isEqualTo("Cardiología");
    assertThat(json.get("datetime").asText()).isEqualTo("2026-03-15T09:30:00");
    assertThat(json.get("branch").asText()).isEqualTo("Centro");
    assertThat(json.get("destination_address").asText()).isEqualTo("ana@medsuy.test");
    verifyNoInteractions(outboxSpool);
  }

  @Test
  @DisplayName("should spool the event when the broker is unreachable")
  void shouldSpoolWhenBrokerUnreachable() {
    // Arrange
    AppointmentEventPublisher publisher = publisherWith(new SyncTaskExecutor());
    AmqpConnectException failure = new AmqpConnectException(new ConnectException("Connection refused"));
    doThrow(failure).when(sender).send(anyString(), anyString(), anyString());

    // Act & Assert: never propagates to the caller
    assertThatCode(() -> publisher.onAppointmentReserved(event)).doesNotThrowAnyException();

    ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);
    verify(outboxSpool).spool(eq("42"), eq("appointment.reserved"),
        eq("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f"), payloadCaptor.capture(), eq(failure));
    assertThat(payloadCaptor.getValue()).contains("\"event_id\":\"7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f\"");
  }

  @Test
  @DisplayName("should spool the event when the publisher executor rejects it")
  void shouldSpoolWhenExecutorRejects() {
    // Arrange
    TaskExecutor saturated = task -> {
      throw new TaskRejectedException("queue full");
    };
    AppointmentEventPublisher publisher = publisherWith(saturated);

    // Act
    publisher.onAppointmentReserved(event);

    // Assert
    verifyNoInteractions(sender);
    verify(outboxSpool).spool(eq("42"), eq("appointment.reserved"),
        eq("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f"), anyString(), any(TaskRejectedException.class));
  }

  @Test
  @DisplayName("should not throw when both sending and spooling fail")
  void shouldNotThrowWhenSpoolFails() {
    // Arrange
    AppointmentEventPublisher publisher = publisherWith(new SyncTaskExecutor());
    doThrow(new AmqpConnectException(new ConnectException("down"))).when(sender)
        .send(anyString(), anyString(), anyString());
    when(outboxSpool.spool(anyString(), anyString(), anyString(), anyString(), any()))
        .thenThrow(new IllegalStateException("database down"));

    // Act & Assert
    assertThatCode(() -> publisher.onAppointmentReserved(event)).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should hand the broker call to the executor instead of running inline")
  void shouldRunOnExecutor() {
    // Arrange: executor that only records the task
    Runnable[] captured = new Runnable[1];
    AppointmentEventPublisher publisher = publisherWith(task -> captured[0] = task);

    // Act
    publisher.onAppointmentReserved(event);

    // Assert: nothing sent until the executor runs the task
    verifyNoInteractions(sender);
    assertThat(captured[0]).isNotNull();

    captured[0].run();
    verify(sender).send(eq("appointment.reserved"), anyString(), anyString());
  }
}
