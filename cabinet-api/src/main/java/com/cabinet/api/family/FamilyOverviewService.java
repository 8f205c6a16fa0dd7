package com.cabinet.api.family;

import com.cabinet.application.family.CapacityPolicy;
import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.domain.model.InviteStatus;
import com.cabinet.saas.domain.model.MemberStatus;
import com.cabinet.saas.infrastructure.family.FamilyDeviceEntity;
import com.cabinet.saas.infrastructure.family.FamilyDeviceRepository;
import com.cabinet.saas.infrastructure.family.FamilyGroupEntity;
import com.cabinet.saas.infrastructure.family.FamilyInviteEntity;
import com.cabinet.saas.infrastructure.family.FamilyInviteRepository;
import com.cabinet.saas.infrastructure.family.FamilyMemberEntity;
import com.cabinet.saas.infrastructure.family.FamilyMemberRepository;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The family page: who is in, who is invited, how many slots and devices are left.
 *
 * An eligible owner without a group gets one created here, so the page always has a group id to
 * work with.
 */
@Service
public class FamilyOverviewService {

  private final AccessContextResolver contexts;
  private final FamilyMembershipTransitions transitions;
  private final UserRepository users;
  private final FamilyMemberRepository members;
  private final FamilyInviteRepository invites;
  private final FamilyDeviceRepository devices;
  private final Clock clock;

  public FamilyOverviewService(
      AccessContextResolver contexts,
      FamilyMembershipTransitions transitions,
      UserRepository users,
      FamilyMemberRepository members,
      FamilyInviteRepository invites,
      FamilyDeviceRepository devices,
      Clock clock
  ) {
    this.contexts = contexts;
    this.transitions = transitions;
    this.users = users;
    this.members = members;
    this.invites = invites;
    this.devices = devices;
    this.clock = clock;
  }

  public record Person(Long userId, String username, String displayName) {}

  public record MemberEntry(
      Long userId,
      String username,
      String displayName,
      String role,
      String status,
      Instant invitedAt,
      Instant acceptedAt,
      boolean canRemove,
      long devicesCount
  ) {}

  public record InviteEntry(
      Long inviteId,
      Long inviteeUserId,
      String username,
      String displayName,
      String status,
      Instant createdAt,
      Instant expiresAt,
      boolean canRevoke
  ) {}

  public record PendingInvite(
      Long inviteId,
      Long familyGroupId,
      String status,
      Instant createdAt,
      Instant expiresAt,
      Long inviterUserId,
      String inviterUsername,
      String inviterDisplayName
  ) {}

  public record UserDevices(Long userId, long count) {}

  public record DeviceSummary(int deviceLimit, int totalUsed, int remaining, List<UserDevices> byUser) {

    static DeviceSummary empty() {
      return new DeviceSummary(0, 0, 0, List.of());
    }
  }

  public record FamilyOverview(
      boolean familyEnabled,
      String role,
      Person owner,
      Long familyGroupId,
      List<MemberEntry> members,
      List<InviteEntry> invites,
      List<PendingInvite> pendingInvitesForYou,
      int maxMembersIncludingOwner,
      int usedSlots,
      int remainingSlots,
      boolean canInvite,
      DeviceSummary deviceSummary
  ) {}

  public FamilyOverview overview(Long userId) {
    AccessContext ctx = contexts.resolve(userId);
    List<PendingInvite> pendingForYou = pendingInvitesFor(userId);

    if (ctx.owner() == null || ctx.subscription() == null) {
      return new FamilyOverview(false, null, null, null, List.of(), List.of(), pendingForYou,
          0, 0, 0, false, DeviceSummary.empty());
    }

    int maxMembers = ctx.tariff() == null ? 0 : ctx.tariff().getFamilyMaxMembers();
    boolean familyEnabled = ctx.tariff() != null
        && CapacityPolicy.familyAvailable(ctx.tariff().isFamilyEnabled(), maxMembers);
    boolean viewerIsOwner = ctx.role() == FamilyRole.OWNER;
    int deviceLimit = ctx.subscription().effectiveDeviceLimit();
    Person owner = person(ctx.owner());

    FamilyGroupEntity group = ctx.group();
    if (group == null && viewerIsOwner && familyEnabled) {
      group = transitions.ensureGroup(ctx.ownerId(), ctx.subscription().getId(), clock.instant());
    }

    if (group == null) {
      return new FamilyOverview(familyEnabled, ctx.role().code(), owner, null, List.of(), List.of(), pendingForYou,
          maxMembers, 1, CapacityPolicy.remainingSlots(0, maxMembers), viewerIsOwner && familyEnabled,
          new DeviceSummary(deviceLimit, 0, deviceLimit, List.of()));
    }

    List<FamilyMemberEntity> memberRows = members.findByFamilyGroupIdAndStatusInOrderByInvitedAtDesc(
        group.getId(), List.of(MemberStatus.ACTIVE.code(), MemberStatus.INVITED.code()));
    List<FamilyInviteEntity> inviteRows = invites.findByFamilyGroupIdAndStatusOrderByCreatedAtDesc(
        group.getId(), InviteStatus.PENDING.code());
    List<FamilyDeviceEntity> deviceRows = devices.findByFamilyGroupId(group.getId());

    Map<Long, Long> byUser = new LinkedHashMap<>();
    for (FamilyDeviceEntity d : deviceRows) {
      byUser.merge(d.getOwnerUserId(), 1L, Long::sum);
    }

    Set<Long> ids = new HashSet<>();
    memberRows.forEach(m -> ids.add(m.getUserId()));
    inviteRows.forEach(i -> ids.add(i.getInviteeUserId()));
    Map<Long, UserEntity> people = usersById(ids);

    List<MemberEntry> memberEntries = new ArrayList<>();
    memberEntries.add(new MemberEntry(owner.userId(), owner.username(), owner.displayName(),
        FamilyRole.OWNER.code(), MemberStatus.ACTIVE.code(), null, null, false,
        byUser.getOrDefault(owner.userId(), 0L)));
    long active = 0;
    for (FamilyMemberEntity m : memberRows) {
      UserEntity u = people.get(m.getUserId());
      if (m.status() == MemberStatus.ACTIVE) active++;
      memberEntries.add(new MemberEntry(
          m.getUserId(),
          u == null ? null : u.getUsername(),
          DisplayNames.of(u),
          m.getRole(),
          m.getStatus(),
          m.getInvitedAt(),
          m.getAcceptedAt(),
          viewerIsOwner,
          byUser.getOrDefault(m.getUserId(), 0L)
      ));
    }

    List<InviteEntry> inviteEntries = inviteRows.stream()
        .map(i -> {
          UserEntity u = people.get(i.getInviteeUserId());
          return new InviteEntry(
              i.getId(),
              i.getInviteeUserId(),
              u == null ? null : u.getUsername(),
              DisplayNames.of(u),
              i.getStatus(),
              i.getCreatedAt(),
              i.getExpiresAt(),
              viewerIsOwner && i.isPending()
          );
        })
        .toList();

    int usedSlots = CapacityPolicy.usedSlots(active);
    int totalUsed = deviceRows.size();
    List<UserDevices> perUser = byUser.entrySet().stream()
        .map(e -> new UserDevices(e.getKey(), e.getValue()))
        .toList();

    return new FamilyOverview(
        familyEnabled,
        ctx.role().code(),
        owner,
        group.getId(),
        memberEntries,
        inviteEntries,
        pendingForYou,
        maxMembers,
        usedSlots,
        CapacityPolicy.remainingSlots(active, maxMembers),
        viewerIsOwner && familyEnabled && usedSlots < maxMembers,
        new DeviceSummary(deviceLimit, totalUsed, Math.max(0, deviceLimit - totalUsed), perUser)
    );
  }

  private List<PendingInvite> pendingInvitesFor(Long userId) {
    List<FamilyInviteEntity> rows = invites.findByInviteeUserIdAndStatusOrderByCreatedAtDesc(userId, InviteStatus.PENDING.code());
    if (rows.isEmpty()) return List.of();
    Map<Long, UserEntity> inviters = usersById(rows.stream().map(FamilyInviteEntity::getInviterUserId).toList());
    return rows.stream()
        .map(i -> {
          UserEntity inviter = inviters.get(i.getInviterUserId());
          return new PendingInvite(
              i.getId(),
              i.getFamilyGroupId(),
              i.getStatus(),
              i.getCreatedAt(),
              i.getExpiresAt(),
              i.getInviterUserId(),
              inviter == null ? null : inviter.getUsername(),
              DisplayNames.of(inviter)
          );
        })
        .toList();
  }

  private Map<Long, UserEntity> usersById(Collection<Long> ids) {
    if (ids.isEmpty()) return Map.of();
    return users.findAllById(ids).stream()
        .collect(Collectors.toMap(UserEntity::getId, Function.identity()));
  }

  private static Person person(UserEntity u) {
    return new Person(u.getId(), u.getUsername(), DisplayNames.of(u));
  }
}
