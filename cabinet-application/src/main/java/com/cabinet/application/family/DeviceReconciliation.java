package com.cabinet.application.family;

import com.cabinet.application.ports.PanelPort.PanelDevice;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Full-replace diff between the locally tracked hwids of a group and the panel's current list.
 *
 * Running it again against an unchanged snapshot yields no inserts and no deletes.
 */
public final class DeviceReconciliation {

  private DeviceReconciliation() {}

  public static Plan plan(
      Collection<String> trackedHwids,
      List<PanelDevice> snapshot,
      Long actorUserId,
      Collection<Long> groupUserIds
  ) {
    Objects.requireNonNull(actorUserId, "actorUserId");
    Set<String> tracked = new LinkedHashSet<>(trackedHwids);

    // panel may list the same hwid twice; last entry wins
    Map<String, PanelDevice> current = new LinkedHashMap<>();
    for (PanelDevice d : snapshot) {
      if (d == null || d.hwid() == null || d.hwid().isBlank()) continue;
      current.put(d.hwid().trim(), d);
    }

    Long attributedTo = attribute(actorUserId, groupUserIds);

    List<Insert> inserts = new ArrayList<>();
    List<PanelDevice> refreshes = new ArrayList<>();
    for (Map.Entry<String, PanelDevice> e : current.entrySet()) {
      PanelDevice d = e.getValue();
      if (tracked.contains(e.getKey())) {
        refreshes.add(d);
      } else {
        inserts.add(new Insert(e.getKey(), attributedTo, d.platform(), d.deviceModel()));
      }
    }

    Set<String> deletes = new LinkedHashSet<>();
    for (String hwid : tracked) {
      if (!current.containsKey(hwid)) deletes.add(hwid);
    }

    return new Plan(
        Collections.unmodifiableList(inserts),
        Collections.unmodifiableList(refreshes),
        Collections.unmodifiableSet(deletes)
    );
  }

  /**
   * New hwids go to the acting user when that user belongs to the group (owner or active member),
   * otherwise to the lowest group user id. The panel does not report which family user registered
   * a device, so this is a heuristic.
   */
  static Long attribute(Long actorUserId, Collection<Long> groupUserIds) {
    TreeSet<Long> candidates = new TreeSet<>(groupUserIds);
    if (candidates.isEmpty() || candidates.contains(actorUserId)) return actorUserId;
    return candidates.first();
  }

  public record Insert(String hwid, Long ownerUserId, String platform, String deviceModel) {}

  public record Plan(List<Insert> inserts, List<PanelDevice> refreshes, Set<String> deletes) {

    public boolean changesRegistry() {
      return !inserts.isEmpty() || !deletes.isEmpty();
    }
  }
}
