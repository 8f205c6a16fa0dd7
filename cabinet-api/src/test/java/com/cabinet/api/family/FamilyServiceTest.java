package com.cabinet.api.family;

import com.cabinet.api.metrics.FamilyMetrics;
import com.cabinet.api.notification.NotificationFanout;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.infrastructure.family.FamilyInviteEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FamilyServiceTest {

  private FamilyMembershipTransitions transitions;
  private FamilyDeviceService deviceService;
  private DeviceReconciler reconciler;
  private NotificationFanout fanout;
  private FamilyMetrics metrics;
  private FamilyService service;

  @BeforeEach
  void setUp() {
    transitions = mock(FamilyMembershipTransitions.class);
    deviceService = mock(FamilyDeviceService.class);
    reconciler = mock(DeviceReconciler.class);
    fanout = mock(NotificationFanout.class);
    metrics = mock(FamilyMetrics.class);
    service = new FamilyService(transitions, deviceService, reconciler, fanout, metrics);
  }

  @Test
  @DisplayName("A unique violation at flush becomes a retryable conflict")
  void uniqueViolationIsConflictRetry() {
    when(transitions.accept(7L, 42L)).thenThrow(new DataIntegrityViolationException("uq_family_members_one_active"));

    assertThatThrownBy(() -> service.acceptInvite(7L, 42L))
        .isInstanceOf(DomainException.class)
        .satisfies(e -> {
          DomainException de = (DomainException) e;
          assertThat(de.code()).isEqualTo(ErrorCode.CONFLICT_RETRY);
          assertThat(de.httpStatus()).isEqualTo(409);
        });

    verify(metrics).incConflicts();
    verifyNoInteractions(fanout, deviceService);
  }

  @Test
  @DisplayName("A lock timeout on invite creation is reported the same way")
  void lockFailureIsConflictRetry() {
    when(transitions.createInvite(1L, "alice")).thenThrow(new CannotAcquireLockException("lock timeout"));

    assertThatThrownBy(() -> service.createInvite(1L, "alice"))
        .isInstanceOf(DomainException.class)
        .hasMessage(ErrorCode.CONFLICT_RETRY.defaultMessage());
    verify(metrics, never()).incInvitesCreated();
  }

  @Test
  @DisplayName("An expired invite is reported after its status was committed")
  void expiredAcceptThrowsAfterCommit() {
    FamilyInviteEntity invite = new FamilyInviteEntity(3L, 7L, 1L, Instant.EPOCH, Instant.EPOCH.plusSeconds(60));
    when(transitions.accept(7L, 42L))
        .thenReturn(new FamilyMembershipTransitions.AcceptOutcome(invite, true, null, null, 3L));

    assertThatThrownBy(() -> service.acceptInvite(7L, 42L))
        .isInstanceOf(DomainException.class)
        .hasMessage(ErrorCode.INVITE_EXPIRED.defaultMessage());

    verify(metrics, never()).incInvitesAccepted();
    verifyNoInteractions(fanout, deviceService);
  }

  @Test
  @DisplayName("Domain rejections pass through untouched")
  void domainErrorsPassThrough() {
    when(transitions.leave(5L)).thenThrow(new DomainException(ErrorCode.NOT_A_MEMBER));

    assertThatThrownBy(() -> service.leave(5L))
        .isInstanceOf(DomainException.class)
        .hasMessage(ErrorCode.NOT_A_MEMBER.defaultMessage());
    verify(metrics, never()).incConflicts();
  }
}
