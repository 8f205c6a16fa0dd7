package com.cabinet.application.family;

import com.cabinet.application.ports.PanelPort.PanelDevice;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceReconciliationTest {

  @Test
  void insertsNewDeletesMissingAndRefreshesKnown() {
    var plan = DeviceReconciliation.plan(
        List.of("keep", "gone"),
        List.of(new PanelDevice("keep", "iOS", "iPhone"), new PanelDevice("fresh", "Android", "Pixel")),
        1L,
        List.of(1L, 2L)
    );

    assertThat(plan.inserts()).extracting(DeviceReconciliation.Insert::hwid).containsExactly("fresh");
    assertThat(plan.inserts().get(0).ownerUserId()).isEqualTo(1L);
    assertThat(plan.refreshes()).extracting(PanelDevice::hwid).containsExactly("keep");
    assertThat(plan.deletes()).containsExactly("gone");
    assertThat(plan.changesRegistry()).isTrue();
  }

  @Test
  void secondRunOnSameSnapshotIsNoop() {
    List<PanelDevice> snapshot = List.of(new PanelDevice("a", "iOS", "iPhone"), new PanelDevice("b", "macOS", "Mac"));

    var first = DeviceReconciliation.plan(List.of(), snapshot, 5L, List.of(5L));
    List<String> afterFirst = first.inserts().stream().map(DeviceReconciliation.Insert::hwid).toList();

    var second = DeviceReconciliation.plan(afterFirst, snapshot, 5L, List.of(5L));

    assertThat(second.inserts()).isEmpty();
    assertThat(second.deletes()).isEmpty();
    assertThat(second.changesRegistry()).isFalse();
  }

  @Test
  void actorOutsideGroupFallsBackToLowestGroupUser() {
    assertThat(DeviceReconciliation.attribute(99L, Set.of(7L, 3L, 12L))).isEqualTo(3L);
    assertThat(DeviceReconciliation.attribute(7L, Set.of(7L, 3L))).isEqualTo(7L);
    assertThat(DeviceReconciliation.attribute(4L, Set.of())).isEqualTo(4L);
  }

  @Test
  void blankAndDuplicateHwidsAreIgnored() {
    var plan = DeviceReconciliation.plan(
        List.of(),
        List.of(new PanelDevice(" ", "x", "y"), new PanelDevice("dup", "iOS", "old"), new PanelDevice("dup", "iOS", "new")),
        1L,
        List.of(1L)
    );

    assertThat(plan.inserts()).hasSize(1);
    assertThat(plan.inserts().get(0).deviceModel()).isEqualTo("new");
  }
}
