package com.medsuy.notificationservice.subscriber;

import com.medsuy.notificationservice.config.NotificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitOperations;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static com.medsuy.common.messaging.NotificationTopology.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationRetryScheduler Unit Tests")
class NotificationRetrySchedulerTest {

  @Mock
  private RabbitTemplate rabbitTemplate;
  @Mock
  private RabbitOperations operations;

  private NotificationRetryScheduler retryScheduler;

  @BeforeEach
  void setUp() {
    NotificationProperties properties = new NotificationProperties();
    properties.getRetry().setInitialDelay(Duration.ofSeconds(5));
    properties.getRetry().setMultiplier(2.0);
    properties.getRetry().setMaxDelay(Duration.ofSeconds(30));
    retryScheduler = new NotificationRetryScheduler(rabbitTemplate, properties);
  }

  @Test
  @DisplayName("should grow the delay exponentially per attempt up to the cap")
  void shouldComputeDelays() {
    assertThat(retryScheduler.delayBeforeAttempt(2)).isEqualTo(5_000);
    assertThat(retryScheduler.delayBeforeAttempt(3)).isEqualTo(10_000);
    assertThat(retryScheduler.delayBeforeAttempt(4)).isEqualTo(20_000);
    assertThat(retryScheduler.delayBeforeAttempt(5)).isEqualTo(30_000);
    assertThat(retryScheduler.delayBeforeAttempt(10)).isEqualTo(30_000);
  }

  @Test
  @DisplayName("should park a persistent copy on the retry queue with TTL and attempt header")
  void shouldRepublishToRetryExchange() throws Exception {
    // Arrange
    doAnswer(inv -> ((RabbitOperations.OperationsCallback<?>) inv.getArgument(0)).doInRabbit(operations))
        .when(rabbitTemplate).invoke(any());
    MessageProperties props = new MessageProperties();
    props.setMessageId("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f");
    props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
    props.setDeliveryTag(17L);
    Message original = new Message("{\"event_id\":\"x\"}".getBytes(StandardCharsets.UTF_8), props);

    // Act
    retryScheduler.scheduleRetry(original, 3);

    // Assert
    ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
    verify(operations).send(eq(RETRY_EXCHANGE), eq(ROUTING_KEY_APPOINTMENT_RESERVED), captor.capture());
    verify(operations).waitForConfirmsOrDie(anyLong());

    Message retry = captor.getValue();
    assertThat(retry.getBody()).isEqualTo(original.getBody());
    assertThat(retry.getMessageProperties().getMessageId()).isEqualTo("7f1c1c3e-2b1a-4d4e-9a59-0c4a3b2d1e0f");
    assertThat((Object) retry.getMessageProperties().getHeader(HEADER_DELIVERY_ATTEMPT)).isEqualTo(3);
    assertThat(retry.getMessageProperties().getExpiration()).isEqualTo("10000");
    assertThat(retry.getMessageProperties().getDeliveryMode()).isEqualTo(MessageDeliveryMode.PERSISTENT);

    // original left untouched
    assertThat((Object) original.getMessageProperties().getHeader(HEADER_DELIVERY_ATTEMPT)).isNull();
  }

  @Test
  @DisplayName("should surface a missing broker confirm to the caller")
  void shouldPropagateConfirmFailure() {
    // Arrange
    doThrow(new AmqpTimeoutException("no confirm")).when(rabbitTemplate).invoke(any());
    Message original = new Message(new byte[0], new MessageProperties());

    // Act & Assert
    assertThatThrownBy(() -> retryScheduler.scheduleRetry(original, 2))
        .isInstanceOf(AmqpTimeoutException.class);
  }
}
