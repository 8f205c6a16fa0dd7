package com.cabinet.api.family;

import com.cabinet.application.ports.PanelApiException;
import com.cabinet.application.ports.PanelPort;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.infrastructure.family.FamilyDeviceEntity;
import com.cabinet.saas.infrastructure.family.FamilyDeviceRepository;
import com.cabinet.saas.infrastructure.user.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Caller-facing device operations on a family group.
 *
 * An owner may delete any device of the group. A member may delete only devices attributed to
 * them. Remote deletes go to the owner's panel user, since the panel only knows that identity.
 */
@Service
public class FamilyDeviceService {

  private static final Logger log = LoggerFactory.getLogger(FamilyDeviceService.class);

  private final AccessContextResolver contexts;
  private final FamilyDeviceRepository devices;
  private final DeviceReconciler reconciler;
  private final PanelPort panel;

  public FamilyDeviceService(
      AccessContextResolver contexts,
      FamilyDeviceRepository devices,
      DeviceReconciler reconciler,
      PanelPort panel
  ) {
    this.contexts = contexts;
    this.devices = devices;
    this.reconciler = reconciler;
    this.panel = panel;
  }

  public record DeviceView(
      String hwid,
      Long ownerUserId,
      String platform,
      String deviceModel,
      Instant lastSeenAt,
      boolean canDelete
  ) {}

  public record DeviceList(Long familyGroupId, List<DeviceView> devices, int total) {}

  public record DeletionResult(boolean success, int deleted, int remoteDeleted) {}

  public DeviceList list(Long userId) {
    AccessContext ctx = requireGroup(userId);
    List<DeviceView> views = devices.findByFamilyGroupId(ctx.groupId()).stream()
        .map(d -> new DeviceView(
            d.getHwid(),
            d.getOwnerUserId(),
            d.getPlatform(),
            d.getDeviceModel(),
            d.getLastSeenAt(),
            canDelete(ctx, d)
        ))
        .toList();
    return new DeviceList(ctx.groupId(), views, views.size());
  }

  /** On-demand reconciliation against the owner's panel device list, attributed to the requester. */
  public DeviceList syncFromPanel(Long userId) {
    AccessContext ctx = requireGroup(userId);
    if (!panel.isConfigured()) {
      throw new DomainException(ErrorCode.PANEL_NOT_CONFIGURED);
    }
    String ownerUuid = ctx.owner().getPanelUuid();
    if (ownerUuid == null || ownerUuid.isBlank()) {
      log.info("Family device sync skipped: owner {} has no panel identity", ctx.ownerId());
      return list(userId);
    }

    PanelPort.PanelDevices snapshot;
    try {
      snapshot = panel.getUserDevices(ownerUuid);
    } catch (PanelApiException e) {
      throw new DomainException(ErrorCode.PANEL_UNAVAILABLE, ErrorCode.PANEL_UNAVAILABLE.defaultMessage(), e);
    }
    reconciler.sync(ctx.groupId(), ctx.requester().getId(), snapshot.devices());
    return list(userId);
  }

  /**
   * Seeds device attribution right after an accept. Best-effort: the accept already committed.
   */
  public void trySeedAfterAccept(Long groupId, UserEntity owner) {
    if (owner == null || owner.getPanelUuid() == null || owner.getPanelUuid().isBlank() || !panel.isConfigured()) {
      return;
    }
    try {
      PanelPort.PanelDevices snapshot = panel.getUserDevices(owner.getPanelUuid());
      reconciler.sync(groupId, owner.getId(), snapshot.devices());
    } catch (PanelApiException e) {
      log.warn("Failed to seed family device ownership on invite accept: group={} status={} error={}",
          groupId, e.statusCode(), e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Failed to store family device ownership on invite accept: group={} error={}", groupId, e.toString());
    }
  }

  public DeletionResult deleteOne(Long userId, String hwid) {
    if (hwid == null || hwid.isBlank()) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "hwid is required");
    }
    String key = hwid.trim();
    AccessContext ctx = requireGroup(userId);
    FamilyDeviceEntity row = devices.findByFamilyGroupIdAndHwid(ctx.groupId(), key).orElse(null);

    switch (ctx.role()) {
      case OWNER -> {
        // owner may delete hwids that were never reconciled locally
      }
      case MEMBER -> {
        if (row == null) throw new DomainException(ErrorCode.DEVICE_NOT_FOUND);
        if (!row.getOwnerUserId().equals(userId)) throw new DomainException(ErrorCode.FORBIDDEN_DEVICE_DELETE);
      }
      case NONE -> throw new DomainException(ErrorCode.NO_FAMILY_GROUP);
    }

    int remote = reconciler.purgeRemote(ctx.owner().getPanelUuid(), List.of(key));
    if (row != null) devices.delete(row);
    return new DeletionResult(true, row == null ? 0 : 1, remote);
  }

  public DeletionResult deleteAll(Long userId) {
    AccessContext ctx = requireGroup(userId);
    List<FamilyDeviceEntity> rows = switch (ctx.role()) {
      case OWNER -> devices.findByFamilyGroupId(ctx.groupId());
      case MEMBER -> devices.findByFamilyGroupIdAndOwnerUserId(ctx.groupId(), userId);
      case NONE -> throw new DomainException(ErrorCode.NO_FAMILY_GROUP);
    };
    if (rows.isEmpty()) return new DeletionResult(true, 0, 0);

    List<String> hwids = rows.stream().map(FamilyDeviceEntity::getHwid).toList();
    int remote = reconciler.purgeRemote(ctx.owner().getPanelUuid(), hwids);
    devices.deleteAll(rows);
    return new DeletionResult(true, rows.size(), remote);
  }

  private static boolean canDelete(AccessContext ctx, FamilyDeviceEntity d) {
    return switch (ctx.role()) {
      case OWNER -> true;
      case MEMBER -> d.getOwnerUserId().equals(ctx.requester().getId());
      case NONE -> false;
    };
  }

  private AccessContext requireGroup(Long userId) {
    AccessContext ctx = contexts.resolve(userId);
    if (ctx.requester() == null) {
      throw new DomainException(ErrorCode.USER_NOT_FOUND);
    }
    if (!ctx.hasGroup() || ctx.owner() == null) {
      throw new DomainException(ErrorCode.NO_FAMILY_GROUP);
    }
    return ctx;
  }
}
