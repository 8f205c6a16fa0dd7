package com.cabinet.api.family;

import com.cabinet.application.ports.PanelApiException;
import com.cabinet.application.ports.PanelPort;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.infrastructure.family.FamilyDeviceEntity;
import com.cabinet.saas.infrastructure.family.FamilyDeviceRepository;
import com.cabinet.saas.infrastructure.family.FamilyGroupEntity;
import com.cabinet.saas.infrastructure.user.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FamilyDeviceServiceTest {

  private static final Long GROUP_ID = 10L;

  private AccessContextResolver contexts;
  private FamilyDeviceRepository devices;
  private DeviceReconciler reconciler;
  private PanelPort panel;
  private FamilyDeviceService service;

  private UserEntity owner;
  private UserEntity member;
  private FamilyGroupEntity group;

  @BeforeEach
  void setUp() {
    contexts = mock(AccessContextResolver.class);
    devices = mock(FamilyDeviceRepository.class);
    reconciler = mock(DeviceReconciler.class);
    panel = mock(PanelPort.class);
    service = new FamilyDeviceService(contexts, devices, reconciler, panel);

    owner = user(1L, "owner", "panel-owner");
    member = user(2L, "member", null);
    group = new FamilyGroupEntity(1L, 100L, Instant.EPOCH);
    ReflectionTestUtils.setField(group, "id", GROUP_ID);

    when(contexts.resolve(1L)).thenReturn(new AccessContext(owner, owner, null, null, group, FamilyRole.OWNER));
    when(contexts.resolve(2L)).thenReturn(new AccessContext(member, owner, null, null, group, FamilyRole.MEMBER));
  }

  @Test
  @DisplayName("Member cannot delete a device attributed to the owner")
  void memberCannotDeleteOwnerDevice() {
    when(devices.findByFamilyGroupIdAndHwid(GROUP_ID, "hw-1"))
        .thenReturn(Optional.of(new FamilyDeviceEntity(GROUP_ID, "hw-1", 1L, "ios", "iPhone", Instant.EPOCH)));

    assertThatThrownBy(() -> service.deleteOne(2L, "hw-1"))
        .isInstanceOf(DomainException.class)
        .satisfies(e -> {
          assertThat(((DomainException) e).code()).isEqualTo(ErrorCode.FORBIDDEN_DEVICE_DELETE);
          assertThat(e.getMessage()).isEqualTo("Family member cannot delete owner devices");
        });
    verify(reconciler, never()).purgeRemote(any(), anyCollection());
  }

  @Test
  @DisplayName("Member gets 404 for a device the group does not track")
  void memberUnknownDevice() {
    when(devices.findByFamilyGroupIdAndHwid(GROUP_ID, "hw-x")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteOne(2L, "hw-x"))
        .isInstanceOf(DomainException.class)
        .hasMessage(ErrorCode.DEVICE_NOT_FOUND.defaultMessage());
  }

  @Test
  @DisplayName("Owner may delete an hwid that was never reconciled locally")
  void ownerDeletesUntrackedDevice() {
    when(devices.findByFamilyGroupIdAndHwid(GROUP_ID, "hw-x")).thenReturn(Optional.empty());
    when(reconciler.purgeRemote("panel-owner", List.of("hw-x"))).thenReturn(1);

    FamilyDeviceService.DeletionResult result = service.deleteOne(1L, " hw-x ");

    assertThat(result.deleted()).isZero();
    assertThat(result.remoteDeleted()).isEqualTo(1);
    verify(devices, never()).delete(any());
  }

  @Test
  @DisplayName("Member delete-all only touches their own devices")
  void memberDeleteAllIsScoped() {
    FamilyDeviceEntity own = new FamilyDeviceEntity(GROUP_ID, "hw-m", 2L, "android", "Pixel", Instant.EPOCH);
    when(devices.findByFamilyGroupIdAndOwnerUserId(GROUP_ID, 2L)).thenReturn(List.of(own));
    when(reconciler.purgeRemote("panel-owner", List.of("hw-m"))).thenReturn(1);

    FamilyDeviceService.DeletionResult result = service.deleteAll(2L);

    assertThat(result.deleted()).isEqualTo(1);
    verify(devices).deleteAll(List.of(own));
    verify(devices, never()).findByFamilyGroupId(GROUP_ID);
  }

  @Test
  @DisplayName("Listing marks only the member's own devices as deletable")
  void canDeleteFlags() {
    when(devices.findByFamilyGroupId(GROUP_ID)).thenReturn(List.of(
        new FamilyDeviceEntity(GROUP_ID, "hw-o", 1L, "ios", "iPad", Instant.EPOCH),
        new FamilyDeviceEntity(GROUP_ID, "hw-m", 2L, "android", "Pixel", Instant.EPOCH)
    ));

    var forMember = service.list(2L);
    var forOwner = service.list(1L);

    assertThat(forMember.devices()).extracting(FamilyDeviceService.DeviceView::canDelete).containsExactly(false, true);
    assertThat(forOwner.devices()).extracting(FamilyDeviceService.DeviceView::canDelete).containsExactly(true, true);
    assertThat(forOwner.total()).isEqualTo(2);
  }

  @Test
  @DisplayName("Sync maps an unconfigured panel to 503 and a failing one to 502")
  void syncErrors() throws Exception {
    when(panel.isConfigured()).thenReturn(false);
    assertThatThrownBy(() -> service.syncFromPanel(1L))
        .isInstanceOf(DomainException.class)
        .extracting(e -> ((DomainException) e).httpStatus()).isEqualTo(503);

    when(panel.isConfigured()).thenReturn(true);
    when(panel.getUserDevices("panel-owner")).thenThrow(new PanelApiException("boom", 500, null));
    assertThatThrownBy(() -> service.syncFromPanel(1L))
        .isInstanceOf(DomainException.class)
        .extracting(e -> ((DomainException) e).httpStatus()).isEqualTo(502);
  }

  @Test
  @DisplayName("Sync reconciles against the owner's panel identity on behalf of the requester")
  void syncAttributesToRequester() throws Exception {
    var snapshot = new PanelPort.PanelDevices(List.of(new PanelPort.PanelDevice("hw-1", "ios", "iPhone")), 1);
    when(panel.isConfigured()).thenReturn(true);
    when(panel.getUserDevices("panel-owner")).thenReturn(snapshot);
    when(devices.findByFamilyGroupId(GROUP_ID)).thenReturn(List.of());

    service.syncFromPanel(2L);

    verify(reconciler).sync(GROUP_ID, 2L, snapshot.devices());
  }

  private static UserEntity user(Long id, String username, String panelUuid) {
    UserEntity u = new UserEntity(username, 1000L + id, panelUuid, Instant.EPOCH);
    ReflectionTestUtils.setField(u, "id", id);
    return u;
  }
}
