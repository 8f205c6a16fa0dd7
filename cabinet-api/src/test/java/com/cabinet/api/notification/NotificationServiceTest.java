package com.cabinet.api.notification;

import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.infrastructure.notification.UserNotificationEntity;
import com.cabinet.saas.infrastructure.notification.UserNotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private UserNotificationRepository repo;
  private NotificationService service;

  @BeforeEach
  void setUp() {
    repo = mock(UserNotificationRepository.class);
    service = new NotificationService(repo, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("limit is clamped to 1..100 and a negative offset to 0")
  void clampsPaging() {
    when(repo.findPage(1L, 0, 100)).thenReturn(List.of());
    when(repo.findPage(1L, 5, 1)).thenReturn(List.of());

    var wide = service.list(1L, 500, -3);
    var narrow = service.list(1L, 0, 5);
    var defaults = service.list(1L, null, null);

    assertThat(wide.limit()).isEqualTo(100);
    assertThat(wide.offset()).isZero();
    assertThat(narrow.limit()).isEqualTo(1);
    assertThat(defaults.limit()).isEqualTo(NotificationService.DEFAULT_LIMIT);
    verify(repo).findPage(1L, 0, 100);
    verify(repo).findPage(1L, 5, 1);
    verify(repo).findPage(1L, 0, 20);
  }

  @Test
  @DisplayName("Payload JSON is returned as a map")
  void payloadIsParsed() {
    UserNotificationEntity n = new UserNotificationEntity(1L, "family_invite_received", "Family invitation",
        "You were invited", "{\"invite_id\":42}", NOW);
    when(repo.findPage(1L, 0, 20)).thenReturn(List.of(n));
    when(repo.countByUserId(1L)).thenReturn(1L);
    when(repo.countByUserIdAndReadAtIsNull(1L)).thenReturn(1L);

    var page = service.list(1L, null, null);

    assertThat(page.total()).isEqualTo(1);
    assertThat(page.unread()).isEqualTo(1);
    assertThat(page.items().get(0).payload()).containsEntry("invite_id", 42);
    assertThat(page.items().get(0).isRead()).isFalse();
  }

  @Test
  @DisplayName("Marking someone else's notification is a 404")
  void markReadOfForeignNotification() {
    when(repo.findByIdAndUserId(9L, 1L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.markRead(1L, 9L))
        .isInstanceOf(DomainException.class)
        .hasMessage(ErrorCode.NOTIFICATION_NOT_FOUND.defaultMessage());
  }

  @Test
  void markReadStampsTime() {
    UserNotificationEntity n = new UserNotificationEntity(1L, "family_member_left", "Family member left", "x", null, NOW);
    when(repo.findByIdAndUserId(3L, 1L)).thenReturn(Optional.of(n));
    when(repo.save(any(UserNotificationEntity.class))).thenAnswer(inv -> inv.getArgument(0));

    var view = service.markRead(1L, 3L);

    assertThat(view.isRead()).isTrue();
    assertThat(view.readAt()).isEqualTo(NOW);
  }
}
