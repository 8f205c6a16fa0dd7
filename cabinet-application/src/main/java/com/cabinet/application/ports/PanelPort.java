package com.cabinet.application.ports;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Narrow view of the external VPN panel.
 *
 * Identities are panel user UUIDs. Every remote call may fail with {@link PanelApiException};
 * callers decide whether that failure is fatal or best-effort.
 */
public interface PanelPort {

  /** False when no base url / token is configured; callers must not issue requests then. */
  boolean isConfigured();

  PanelDevices getUserDevices(String userUuid) throws PanelApiException;

  void deleteDevice(String userUuid, String hwid) throws PanelApiException;

  RemoteUser createUser(NewRemoteUser request) throws PanelApiException;

  Optional<RemoteUser> getUser(String userUuid) throws PanelApiException;

  /** @return true when the panel confirmed the deletion */
  boolean deleteUser(String userUuid) throws PanelApiException;

  Optional<NodeInfo> getNode(String nodeUuid) throws PanelApiException;

  List<NodeInfo> listNodes() throws PanelApiException;

  Optional<SquadInfo> getSquad(String squadUuid) throws PanelApiException;

  List<SquadInfo> listSquads() throws PanelApiException;

  /** @return true when the panel accepted the restart action */
  boolean restartNode(String nodeUuid) throws PanelApiException;

  /**
   * One hardware registration as reported by the panel.
   */
  record PanelDevice(String hwid, String platform, String deviceModel) {

    public static final String UNKNOWN = "Unknown";

    /**
     * Panel payloads are loosely typed and field names vary between panel versions.
     * Returns null when no usable hardware id is present.
     */
    public static PanelDevice fromRaw(Map<String, ?> raw) {
      if (raw == null) return null;
      String hwid = firstText(raw, "hwid", "deviceId", "id");
      if (hwid == null) return null;
      String platform = firstText(raw, "platform", "platformType");
      String model = firstText(raw, "deviceModel", "model", "name");
      return new PanelDevice(hwid, platform == null ? UNKNOWN : platform, model == null ? UNKNOWN : model);
    }

    private static String firstText(Map<String, ?> raw, String... keys) {
      for (String k : keys) {
        Object v = raw.get(k);
        if (v == null) continue;
        String s = v.toString().trim();
        if (!s.isEmpty()) return s;
      }
      return null;
    }
  }

  record PanelDevices(List<PanelDevice> devices, int total) {

    public static PanelDevices empty() {
      return new PanelDevices(List.of(), 0);
    }
  }

  record NewRemoteUser(
      String username,
      Instant expireAt,
      long trafficLimitBytes,
      int hwidDeviceLimit,
      String description,
      List<String> activeInternalSquads
  ) {}

  record RemoteUser(
      String uuid,
      String username,
      String status,              // "ACTIVE" | "DISABLED" | "LIMITED" | "EXPIRED"
      long trafficLimitBytes,
      long usedTrafficBytes,
      String subscriptionUrl
  ) {}

  record NodeInfo(String uuid, String name, boolean connected, boolean disabled) {

    public boolean online() {
      return connected && !disabled;
    }
  }

  record SquadInfo(String uuid, String name, int membersCount) {}
}
