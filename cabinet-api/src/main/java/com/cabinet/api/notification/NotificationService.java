package com.cabinet.api.notification;

import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.infrastructure.notification.UserNotificationEntity;
import com.cabinet.saas.infrastructure.notification.UserNotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The user's notification inbox.
 */
@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
  private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {};

  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  private final UserNotificationRepository notifications;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public NotificationService(UserNotificationRepository notifications, ObjectMapper objectMapper, Clock clock) {
    this.notifications = notifications;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public record NotificationView(
      Long id,
      String type,
      String title,
      String body,
      Map<String, Object> payload,
      boolean isRead,
      Instant readAt,
      Instant createdAt
  ) {}

  public record NotificationPage(List<NotificationView> items, long total, long unread, int limit, int offset) {}

  /** Newest first. {@code limit} is clamped to 1..100 and {@code offset} to 0 or more. */
  @Transactional(readOnly = true)
  public NotificationPage list(Long userId, Integer limit, Integer offset) {
    int lim = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
    int off = offset == null ? 0 : Math.max(0, offset);

    List<NotificationView> items = notifications.findPage(userId, off, lim).stream()
        .map(this::toView)
        .toList();
    return new NotificationPage(
        items,
        notifications.countByUserId(userId),
        notifications.countByUserIdAndReadAtIsNull(userId),
        lim,
        off
    );
  }

  @Transactional
  public NotificationView markRead(Long userId, Long notificationId) {
    UserNotificationEntity n = notifications.findByIdAndUserId(notificationId, userId)
        .orElseThrow(() -> new DomainException(ErrorCode.NOTIFICATION_NOT_FOUND));
    n.markRead(clock.instant());
    return toView(notifications.save(n));
  }

  @Transactional
  public int markAllRead(Long userId) {
    return notifications.markAllRead(userId, clock.instant());
  }

  private NotificationView toView(UserNotificationEntity n) {
    return new NotificationView(
        n.getId(),
        n.getNotificationType(),
        n.getTitle(),
        n.getBody(),
        readPayload(n),
        n.isRead(),
        n.getReadAt(),
        n.getCreatedAt()
    );
  }

  private Map<String, Object> readPayload(UserNotificationEntity n) {
    if (n.getPayload() == null || n.getPayload().isBlank()) return Map.of();
    try {
      return objectMapper.readValue(n.getPayload(), PAYLOAD);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable payload on notification {}: {}", n.getId(), e.getOriginalMessage());
      return Map.of();
    }
  }
}
