package com.cabinet.api.personalvpn;

import com.cabinet.api.audit.FamilyAuditService;
import com.cabinet.application.family.Handles;
import com.cabinet.application.ports.PanelApiException;
import com.cabinet.application.ports.PanelPort;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.domain.model.InstanceStatus;
import com.cabinet.saas.infrastructure.personalvpn.PersonalVpnInstanceEntity;
import com.cabinet.saas.infrastructure.personalvpn.PersonalVpnInstanceRepository;
import com.cabinet.saas.infrastructure.personalvpn.PersonalVpnUserEntity;
import com.cabinet.saas.infrastructure.personalvpn.PersonalVpnUserRepository;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * A panel node and squad leased to a single owner, who creates sub-users on it.
 *
 * Local rows are the source of truth for ownership and limits; the panel is the source of truth
 * for traffic and online state.
 */
@Service
public class PersonalVpnService {

  private static final Logger log = LoggerFactory.getLogger(PersonalVpnService.class);

  public static final Duration RESTART_COOLDOWN = Duration.ofMinutes(10);
  private static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

  private final PersonalVpnInstanceRepository instances;
  private final PersonalVpnUserRepository subUsers;
  private final UserRepository users;
  private final PanelPort panel;
  private final FamilyAuditService audit;
  private final Clock clock;

  public PersonalVpnService(
      PersonalVpnInstanceRepository instances,
      PersonalVpnUserRepository subUsers,
      UserRepository users,
      PanelPort panel,
      FamilyAuditService audit,
      Clock clock
  ) {
    this.instances = instances;
    this.subUsers = subUsers;
    this.users = users;
    this.panel = panel;
    this.audit = audit;
    this.clock = clock;
  }

  /** Exactly one of the three owner selectors is expected; the first non-null one wins. */
  public record OwnerRef(Long userId, Long telegramId, String username) {}

  public record InstanceView(
      Long id,
      Long ownerUserId,
      String nodeId,
      String squadId,
      Instant expiresAt,
      String status,
      int maxUsers,
      Instant lastRestartAt,
      Instant createdAt
  ) {

    static InstanceView of(PersonalVpnInstanceEntity e, Instant now) {
      return new InstanceView(
          e.getId(),
          e.getOwnerUserId(),
          e.getNodeUuid(),
          e.getSquadUuid(),
          e.getExpiresAt(),
          e.effectiveStatus(now).code(),
          e.getMaxUsers(),
          e.getLastRestartAt(),
          e.getCreatedAt()
      );
    }
  }

  public record NodeStatus(String id, String name, boolean online, Boolean isDisabled) {}

  public record SubUserView(
      Long id,
      String remoteUserId,
      String username,
      Instant expiresAt,
      int deviceLimit,
      long trafficLimitBytes,
      double trafficLimitGb,
      String status,
      long trafficUsedBytes,
      double trafficUsedGb,
      int devicesUsed,
      String subscriptionLink,
      Instant createdAt
  ) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Overview(
      boolean hasInstance,
      Long instanceId,
      String status,
      Instant expiresAt,
      Integer maxUsers,
      Integer currentUserCount,
      Long restartCooldownRemainingSeconds,
      Instant lastRestartAt,
      NodeStatus node,
      List<SubUserView> subUsers
  ) {

    static Overview none() {
      return new Overview(false, null, null, null, null, null, null, null, null, null);
    }
  }

  // --- admin ---

  @Transactional
  public InstanceView assign(Long adminId, OwnerRef ownerRef, String nodeId, String squadId, Instant expiresAt, int maxUsers) {
    if (maxUsers < 1) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "max_users must be at least 1");
    }
    UserEntity owner = resolveOwner(ownerRef);
    if (instances.existsByOwnerUserId(owner.getId())) {
      throw new DomainException(ErrorCode.INSTANCE_ALREADY_ASSIGNED);
    }
    Instant now = clock.instant();
    if (expiresAt == null || !expiresAt.isAfter(now)) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "expires_at must be in the future");
    }

    requireConfigured();
    try {
      if (panel.getNode(nodeId).isEmpty()) throw new DomainException(ErrorCode.NODE_NOT_FOUND);
      if (panel.getSquad(squadId).isEmpty()) throw new DomainException(ErrorCode.SQUAD_NOT_FOUND);
    } catch (PanelApiException e) {
      throw upstream("Failed to validate node and squad", e);
    }

    PersonalVpnInstanceEntity instance;
    try {
      instance = instances.saveAndFlush(new PersonalVpnInstanceEntity(owner.getId(), nodeId, squadId, expiresAt, maxUsers, now));
    } catch (DataIntegrityViolationException e) {
      throw new DomainException(ErrorCode.INSTANCE_ALREADY_ASSIGNED, ErrorCode.INSTANCE_ALREADY_ASSIGNED.defaultMessage(), e);
    }
    audit.logAdmin(adminId, "PERSONAL_VPN_ASSIGNED", FamilyAuditService.TARGET_PERSONAL_VPN, instance.getId());
    log.info("Personal VPN instance assigned: instance={} owner={} node={} squad={}",
        instance.getId(), owner.getId(), nodeId, squadId);
    return InstanceView.of(instance, now);
  }

  @Transactional
  public InstanceView update(Long adminId, Long instanceId, Instant expiresAt, Integer maxUsers) {
    PersonalVpnInstanceEntity instance = instances.findByIdForUpdate(instanceId)
        .orElseThrow(() -> new DomainException(ErrorCode.INSTANCE_NOT_FOUND));
    Instant now = clock.instant();
    if (expiresAt == null && maxUsers == null) {
      return InstanceView.of(instance, now);
    }

    if (maxUsers != null) {
      if (maxUsers < 1) {
        throw new DomainException(ErrorCode.INVALID_ARGUMENT, "max_users must be at least 1");
      }
      long active = subUsers.countByInstanceIdAndDeletedAtIsNull(instance.getId());
      if (maxUsers < active) {
        throw new DomainException(ErrorCode.INVALID_ARGUMENT, "max_users cannot be less than current active users");
      }
      instance.setMaxUsers(maxUsers);
    }

    if (expiresAt != null) {
      instance.setExpiresAt(expiresAt);
      if (expiresAt.isAfter(now) && InstanceStatus.fromCode(instance.getStatus()) == InstanceStatus.EXPIRED) {
        instance.setStatus(InstanceStatus.ACTIVE.code());
      }
    }
    instance.setUpdatedAt(now);
    instances.save(instance);
    audit.logAdmin(adminId, "PERSONAL_VPN_UPDATED", FamilyAuditService.TARGET_PERSONAL_VPN, instance.getId());
    return InstanceView.of(instance, now);
  }

  public List<PanelPort.NodeInfo> listNodes() {
    requireConfigured();
    try {
      return panel.listNodes();
    } catch (PanelApiException e) {
      throw upstream("Failed to list nodes", e);
    }
  }

  public List<PanelPort.SquadInfo> listSquads() {
    requireConfigured();
    try {
      return panel.listSquads();
    } catch (PanelApiException e) {
      throw upstream("Failed to list squads", e);
    }
  }

  // --- owner ---

  public Overview overview(Long ownerUserId) {
    PersonalVpnInstanceEntity instance = instances.findByOwnerUserId(ownerUserId).orElse(null);
    if (instance == null) return Overview.none();

    Instant now = clock.instant();
    List<PersonalVpnUserEntity> rows = subUsers.findByInstanceIdAndDeletedAtIsNullOrderByCreatedAtDesc(instance.getId());

    NodeStatus node = new NodeStatus(instance.getNodeUuid(), null, false, null);
    List<SubUserView> views;
    if (panel.isConfigured()) {
      try {
        Optional<PanelPort.NodeInfo> info = panel.getNode(instance.getNodeUuid());
        if (info.isPresent()) {
          node = new NodeStatus(instance.getNodeUuid(), info.get().name(), info.get().online(), info.get().disabled());
        }
        views = new ArrayList<>();
        for (PersonalVpnUserEntity row : rows) {
          views.add(enriched(row));
        }
      } catch (PanelApiException e) {
        log.warn("Personal VPN overview falls back to stored values: instance={} status={} error={}",
            instance.getId(), e.statusCode(), e.getMessage());
        views = rows.stream().map(PersonalVpnService::stored).toList();
      }
    } else {
      views = rows.stream().map(PersonalVpnService::stored).toList();
    }

    return new Overview(
        true,
        instance.getId(),
        instance.effectiveStatus(now).code(),
        instance.getExpiresAt(),
        instance.getMaxUsers(),
        rows.size(),
        cooldownRemaining(instance.getLastRestartAt(), now),
        instance.getLastRestartAt(),
        node,
        views
    );
  }

  @Transactional
  public InstanceView restartNode(Long ownerUserId) {
    PersonalVpnInstanceEntity instance = lockActionable(ownerUserId);
    Instant now = clock.instant();
    if (cooldownRemaining(instance.getLastRestartAt(), now) > 0) {
      throw new DomainException(ErrorCode.RESTART_COOLDOWN);
    }

    requireConfigured();
    boolean accepted;
    try {
      accepted = panel.restartNode(instance.getNodeUuid());
    } catch (PanelApiException e) {
      throw upstream("Failed to restart node", e);
    }
    if (!accepted) {
      throw new DomainException(ErrorCode.PANEL_UNAVAILABLE, "Failed to restart node");
    }

    instance.setLastRestartAt(now);
    instance.setUpdatedAt(now);
    instances.save(instance);
    audit.logUser(ownerUserId, "PERSONAL_VPN_NODE_RESTARTED", FamilyAuditService.TARGET_PERSONAL_VPN, instance.getId());
    log.info("Personal VPN node restarted: instance={} node={}", instance.getId(), instance.getNodeUuid());
    return InstanceView.of(instance, now);
  }

  @Transactional
  public SubUserView createSubUser(Long ownerUserId, Instant expiresAt, int deviceLimit, double trafficLimitGb) {
    PersonalVpnInstanceEntity instance = lockActionable(ownerUserId);

    if (expiresAt == null) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "expires_at is required");
    }
    if (expiresAt.isAfter(instance.getExpiresAt())) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "Sub-user expiration cannot exceed personal VPN expiration");
    }
    if (subUsers.countByInstanceIdAndDeletedAtIsNull(instance.getId()) >= instance.getMaxUsers()) {
      throw new DomainException(ErrorCode.SUB_USER_LIMIT_REACHED);
    }
    if (deviceLimit < 1) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "device_limit must be at least 1");
    }
    if (trafficLimitGb < 0) {
      throw new DomainException(ErrorCode.INVALID_ARGUMENT, "traffic_limit must be >= 0");
    }

    requireConfigured();
    long trafficBytes = (long) (trafficLimitGb * BYTES_PER_GB);
    String username = "pvpn-" + instance.getOwnerUserId() + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);

    PanelPort.RemoteUser remote;
    try {
      remote = panel.createUser(new PanelPort.NewRemoteUser(
          username,
          expiresAt,
          trafficBytes,
          deviceLimit,
          "Personal VPN sub-user of owner #" + instance.getOwnerUserId(),
          List.of(instance.getSquadUuid())
      ));
    } catch (PanelApiException e) {
      throw upstream("Failed to create sub-user", e);
    }

    PersonalVpnUserEntity row;
    try {
      row = subUsers.saveAndFlush(new PersonalVpnUserEntity(
          instance.getId(),
          remote.uuid(),
          username,
          expiresAt,
          deviceLimit,
          trafficBytes,
          remote.subscriptionUrl(),
          clock.instant()
      ));
    } catch (RuntimeException e) {
      discardRemote(remote.uuid());
      throw new DomainException(ErrorCode.PANEL_UNAVAILABLE, "Failed to create sub-user", e);
    }

    log.info("Personal VPN sub-user created: instance={} subUser={} remote={}", instance.getId(), row.getId(), remote.uuid());
    return fromRemote(row, remote, 0);
  }

  @Transactional
  public void deleteSubUser(Long ownerUserId, Long subUserId) {
    PersonalVpnInstanceEntity instance = lockActionable(ownerUserId);
    PersonalVpnUserEntity row = subUsers.findByIdAndInstanceIdAndDeletedAtIsNull(subUserId, instance.getId())
        .orElseThrow(() -> new DomainException(ErrorCode.SUB_USER_NOT_FOUND));

    requireConfigured();
    boolean deleted;
    try {
      deleted = panel.deleteUser(row.getRemoteUserUuid());
    } catch (PanelApiException e) {
      throw upstream("Failed to delete sub-user", e);
    }
    if (!deleted) {
      throw new DomainException(ErrorCode.PANEL_UNAVAILABLE, "Failed to delete sub-user");
    }

    row.softDelete(clock.instant());
    subUsers.save(row);
    log.info("Personal VPN sub-user deleted: instance={} subUser={}", instance.getId(), row.getId());
  }

  // --- helpers ---

  private PersonalVpnInstanceEntity lockActionable(Long ownerUserId) {
    PersonalVpnInstanceEntity instance = instances.findByOwnerUserIdForUpdate(ownerUserId)
        .orElseThrow(() -> new DomainException(ErrorCode.INSTANCE_NOT_FOUND));
    if (instance.effectiveStatus(clock.instant()) != InstanceStatus.ACTIVE) {
      throw new DomainException(ErrorCode.INSTANCE_NOT_ACTIVE);
    }
    return instance;
  }

  private UserEntity resolveOwner(OwnerRef ref) {
    Optional<UserEntity> owner = Optional.empty();
    if (ref != null) {
      if (ref.userId() != null) {
        owner = users.findById(ref.userId());
      } else if (ref.telegramId() != null) {
        owner = users.findByTelegramId(ref.telegramId());
      } else if (ref.username() != null && !Handles.normalize(ref.username()).isEmpty()) {
        owner = users.findFirstByUsernameIgnoreCaseOrderByIdAsc(Handles.normalize(ref.username()));
      }
    }
    return owner.orElseThrow(() -> new DomainException(ErrorCode.USER_NOT_FOUND, "Owner user not found"));
  }

  private void requireConfigured() {
    if (!panel.isConfigured()) {
      throw new DomainException(ErrorCode.PANEL_NOT_CONFIGURED);
    }
  }

  private void discardRemote(String remoteUuid) {
    try {
      panel.deleteUser(remoteUuid);
    } catch (PanelApiException e) {
      log.warn("Failed to discard orphaned panel user {}: status={} error={}", remoteUuid, e.statusCode(), e.getMessage());
    }
  }

  private SubUserView enriched(PersonalVpnUserEntity row) throws PanelApiException {
    Optional<PanelPort.RemoteUser> remote = panel.getUser(row.getRemoteUserUuid());
    int devices = panel.getUserDevices(row.getRemoteUserUuid()).total();
    return remote.map(r -> fromRemote(row, r, devices)).orElseGet(() -> stored(row));
  }

  private static SubUserView fromRemote(PersonalVpnUserEntity row, PanelPort.RemoteUser remote, int devicesUsed) {
    String link = remote.subscriptionUrl() == null ? row.getSubscriptionLink() : remote.subscriptionUrl();
    return new SubUserView(
        row.getId(),
        row.getRemoteUserUuid(),
        row.getUsername(),
        row.getExpiresAt(),
        row.getDeviceLimit(),
        remote.trafficLimitBytes(),
        gigabytes(remote.trafficLimitBytes()),
        remote.status() == null ? "unknown" : remote.status().toLowerCase(Locale.ROOT),
        remote.usedTrafficBytes(),
        gigabytes(remote.usedTrafficBytes()),
        devicesUsed,
        link,
        row.getCreatedAt()
    );
  }

  private static SubUserView stored(PersonalVpnUserEntity row) {
    return new SubUserView(
        row.getId(),
        row.getRemoteUserUuid(),
        row.getUsername(),
        row.getExpiresAt(),
        row.getDeviceLimit(),
        row.getTrafficLimitBytes(),
        gigabytes(row.getTrafficLimitBytes()),
        "unknown",
        0L,
        0.0,
        0,
        row.getSubscriptionLink(),
        row.getCreatedAt()
    );
  }

  static long cooldownRemaining(Instant lastRestartAt, Instant now) {
    if (lastRestartAt == null) return 0;
    long elapsed = Duration.between(lastRestartAt, now).getSeconds();
    return Math.max(0, RESTART_COOLDOWN.getSeconds() - elapsed);
  }

  private static double gigabytes(long bytes) {
    return Math.round(bytes * 100.0 / BYTES_PER_GB) / 100.0;
  }

  private static DomainException upstream(String message, PanelApiException e) {
    return new DomainException(ErrorCode.PANEL_UNAVAILABLE, message, e);
  }
}
