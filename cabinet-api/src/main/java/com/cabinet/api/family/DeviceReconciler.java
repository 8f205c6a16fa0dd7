package com.cabinet.api.family;

import com.cabinet.api.metrics.FamilyMetrics;
import com.cabinet.application.family.DeviceReconciliation;
import com.cabinet.application.ports.PanelApiException;
import com.cabinet.application.ports.PanelPort;
import com.cabinet.application.ports.PanelPort.PanelDevice;
import com.cabinet.saas.domain.model.MemberStatus;
import com.cabinet.saas.infrastructure.family.FamilyDeviceEntity;
import com.cabinet.saas.infrastructure.family.FamilyDeviceRepository;
import com.cabinet.saas.infrastructure.family.FamilyGroupEntity;
import com.cabinet.saas.infrastructure.family.FamilyGroupRepository;
import com.cabinet.saas.infrastructure.family.FamilyMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mirrors the panel's device list for a group into family_devices and issues remote deletes.
 */
@Service
public class DeviceReconciler {

  private static final Logger log = LoggerFactory.getLogger(DeviceReconciler.class);

  private final FamilyDeviceRepository devices;
  private final FamilyGroupRepository groups;
  private final FamilyMemberRepository members;
  private final PanelPort panel;
  private final FamilyMetrics metrics;
  private final Clock clock;

  public DeviceReconciler(
      FamilyDeviceRepository devices,
      FamilyGroupRepository groups,
      FamilyMemberRepository members,
      PanelPort panel,
      FamilyMetrics metrics,
      Clock clock
  ) {
    this.devices = devices;
    this.groups = groups;
    this.members = members;
    this.panel = panel;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Full replace of the group's registry with {@code snapshot}. Re-running with the same snapshot
   * inserts and deletes nothing.
   */
  @Transactional
  public DeviceReconciliation.Plan sync(Long groupId, Long actorUserId, List<PanelDevice> snapshot) {
    List<FamilyDeviceEntity> rows = devices.findByFamilyGroupId(groupId);
    Map<String, FamilyDeviceEntity> byHwid = rows.stream()
        .collect(Collectors.toMap(FamilyDeviceEntity::getHwid, Function.identity()));

    List<Long> groupUsers = new ArrayList<>(members.findUserIdsByGroupAndStatus(groupId, MemberStatus.ACTIVE.code()));
    groups.findById(groupId).map(FamilyGroupEntity::getOwnerUserId).ifPresent(groupUsers::add);

    DeviceReconciliation.Plan plan = DeviceReconciliation.plan(byHwid.keySet(), snapshot, actorUserId, groupUsers);
    Instant now = clock.instant();

    for (DeviceReconciliation.Insert ins : plan.inserts()) {
      devices.save(new FamilyDeviceEntity(groupId, ins.hwid(), ins.ownerUserId(), ins.platform(), ins.deviceModel(), now));
    }
    for (PanelDevice seen : plan.refreshes()) {
      FamilyDeviceEntity row = byHwid.get(seen.hwid().trim());
      if (row != null) row.refresh(seen.platform(), seen.deviceModel(), now);
    }
    for (String gone : plan.deletes()) {
      devices.delete(byHwid.get(gone));
    }

    if (plan.changesRegistry()) {
      log.info("Family devices reconciled: group={} inserted={} deleted={}",
          groupId, plan.inserts().size(), plan.deletes().size());
    }
    return plan;
  }

  /**
   * One remote delete per hwid on the owner's panel user. Failures are logged per hwid and
   * never stop the batch.
   *
   * @return how many deletes the panel accepted
   */
  public int purgeRemote(String ownerPanelUuid, Collection<String> hwids) {
    if (hwids.isEmpty()) return 0;
    if (ownerPanelUuid == null || ownerPanelUuid.isBlank() || !panel.isConfigured()) {
      log.warn("Skipping remote device cleanup for {} hwid(s): owner has no panel identity or panel is not configured",
          hwids.size());
      return 0;
    }
    int removed = 0;
    for (String hwid : hwids) {
      try {
        panel.deleteDevice(ownerPanelUuid, hwid);
        removed++;
      } catch (PanelApiException e) {
        metrics.incRemoteDeleteFailed();
        log.warn("Failed to delete family device from panel: hwid={} status={} error={}",
            hwid, e.statusCode(), e.getMessage());
      }
    }
    return removed;
  }
}
