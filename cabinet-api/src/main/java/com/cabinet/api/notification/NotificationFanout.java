package com.cabinet.api.notification;

import com.cabinet.api.metrics.FamilyMetrics;
import com.cabinet.application.ports.MessengerPort;
import com.cabinet.application.ports.RealtimePort;
import com.cabinet.saas.infrastructure.notification.UserNotificationEntity;
import com.cabinet.saas.infrastructure.notification.UserNotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers notifications after a membership transition has committed.
 *
 * The inbox row is written and the realtime event pushed in a transaction of their own; if either
 * fails that row is rolled back and the failure is logged. Nothing here propagates to the caller.
 */
@Service
public class NotificationFanout {

  private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

  private final UserNotificationRepository notifications;
  private final RealtimePort realtime;
  private final MessengerPort messenger;
  private final TransactionTemplate requiresNew;
  private final ObjectMapper objectMapper;
  private final FamilyMetrics metrics;
  private final Clock clock;

  public NotificationFanout(
      UserNotificationRepository notifications,
      RealtimePort realtime,
      MessengerPort messenger,
      TransactionTemplate requiresNew,
      ObjectMapper objectMapper,
      FamilyMetrics metrics,
      Clock clock
  ) {
    this.notifications = notifications;
    this.realtime = realtime;
    this.messenger = messenger;
    this.requiresNew = requiresNew;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** @return true when the row was stored and the event pushed */
  public boolean notify(Long userId, NotificationType type, String body, Map<String, Object> payload) {
    if (userId == null) return false;
    try {
      requiresNew.executeWithoutResult(status -> {
        notifications.save(new UserNotificationEntity(
            userId,
            type.code(),
            type.title(),
            body,
            toJson(payload),
            clock.instant()
        ));

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type.realtimeType());
        event.put("title", type.title());
        event.put("message", body);
        event.putAll(payload);
        realtime.push(userId, event);
      });
      return true;
    } catch (RuntimeException e) {
      metrics.incNotificationsFailed();
      log.warn("Failed to deliver {} notification to user {}: {}", type.code(), userId, e.toString());
      return false;
    }
  }

  /** Chat message to a messenger account; skipped when the user never started the bot. */
  public void message(Long telegramId, String text, List<MessengerPort.Action> actions) {
    if (telegramId == null) return;
    try {
      messenger.send(telegramId, text, actions);
    } catch (RuntimeException e) {
      log.warn("Failed to message telegram user {}: {}", telegramId, e.toString());
    }
  }

  private String toJson(Map<String, Object> payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Notification payload is not serializable", e);
    }
  }
}
