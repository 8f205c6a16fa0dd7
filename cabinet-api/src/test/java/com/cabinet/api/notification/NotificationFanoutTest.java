package com.cabinet.api.notification;

import com.cabinet.api.metrics.FamilyMetrics;
import com.cabinet.application.ports.MessengerPort;
import com.cabinet.application.ports.RealtimePort;
import com.cabinet.saas.infrastructure.notification.UserNotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class NotificationFanoutTest {

  private MessengerPort messenger;
  private NotificationFanout fanout;

  @BeforeEach
  void setUp() {
    messenger = mock(MessengerPort.class);
    fanout = new NotificationFanout(
        mock(UserNotificationRepository.class),
        mock(RealtimePort.class),
        messenger,
        mock(TransactionTemplate.class),
        new ObjectMapper(),
        new FamilyMetrics(new SimpleMeterRegistry()),
        Clock.systemUTC()
    );
  }

  @Test
  @DisplayName("A messenger failure after commit is logged, not thrown")
  void messengerFailureDoesNotEscape() {
    doThrow(new IllegalArgumentException("unexpected url"))
        .when(messenger).send(anyLong(), anyString(), anyList());

    assertThatCode(() -> fanout.message(1002L, "You were invited", List.of()))
        .doesNotThrowAnyException();
    verify(messenger).send(1002L, "You were invited", List.of());
  }

  @Test
  void userWithoutTelegramIsSkipped() {
    fanout.message(null, "You were invited", List.of());

    verifyNoInteractions(messenger);
  }
}
