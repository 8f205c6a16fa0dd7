package com.cabinet.api.family;

import com.cabinet.api.audit.FamilyAuditService;
import com.cabinet.application.family.Handles;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.domain.model.InviteStatus;
import com.cabinet.saas.domain.model.MemberStatus;
import com.cabinet.saas.infrastructure.family.FamilyDeviceEntity;
import com.cabinet.saas.infrastructure.family.FamilyDeviceRepository;
import com.cabinet.saas.infrastructure.family.FamilyGroupEntity;
import com.cabinet.saas.infrastructure.family.FamilyGroupRepository;
import com.cabinet.saas.infrastructure.family.FamilyInviteEntity;
import com.cabinet.saas.infrastructure.family.FamilyInviteRepository;
import com.cabinet.saas.infrastructure.family.FamilyMemberEntity;
import com.cabinet.saas.infrastructure.family.FamilyMemberRepository;
import com.cabinet.saas.infrastructure.subscription.SubscriptionEntity;
import com.cabinet.saas.infrastructure.tariff.TariffEntity;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Membership state changes, one transaction per method.
 *
 * Every check runs before the first write. Lock order is invite or member row first, group row
 * second; no method ever locks two groups. Writes are flushed inside the method so constraint
 * violations surface here rather than at commit. Side effects that must not be rolled back with
 * the transition (notifications, remote panel calls) are left to {@link FamilyService}.
 */
@Service
public class FamilyMembershipTransitions {

  private final UserRepository users;
  private final FamilyGroupRepository groups;
  private final FamilyMemberRepository members;
  private final FamilyInviteRepository invites;
  private final FamilyDeviceRepository devices;
  private final AccessContextResolver contexts;
  private final CapacityEnforcer capacity;
  private final FamilyAuditService audit;
  private final FamilyProperties props;
  private final Clock clock;

  public FamilyMembershipTransitions(
      UserRepository users,
      FamilyGroupRepository groups,
      FamilyMemberRepository members,
      FamilyInviteRepository invites,
      FamilyDeviceRepository devices,
      AccessContextResolver contexts,
      CapacityEnforcer capacity,
      FamilyAuditService audit,
      FamilyProperties props,
      Clock clock
  ) {
    this.users = users;
    this.groups = groups;
    this.members = members;
    this.invites = invites;
    this.devices = devices;
    this.contexts = contexts;
    this.capacity = capacity;
    this.audit = audit;
    this.props = props;
    this.clock = clock;
  }

  public record InviteIssued(FamilyInviteEntity invite, UserEntity owner, UserEntity invitee) {}

  /** {@code expired} means the invite was found past its expiry and has been closed as such. */
  public record AcceptOutcome(FamilyInviteEntity invite, boolean expired, UserEntity member, UserEntity owner, Long groupId) {}

  /** {@code counterpart} is whoever should hear about the decision. */
  public record InviteClosed(FamilyInviteEntity invite, UserEntity actor, UserEntity counterpart) {}

  /** {@code releasedHwids} were deleted locally and still need a remote delete on the owner's panel user. */
  public record MemberReleased(Long groupId, UserEntity owner, UserEntity member, List<String> releasedHwids) {}

  @Transactional
  public InviteIssued createInvite(Long ownerUserId, String inviteeHandle) {
    Instant now = clock.instant();

    UserEntity owner = users.findById(ownerUserId)
        .orElseThrow(() -> new DomainException(ErrorCode.USER_NOT_FOUND));
    SubscriptionEntity subscription = contexts.subscriptionOf(owner.getId());
    TariffEntity tariff = contexts.tariffOf(subscription);
    int maxMembers = capacity.requireFamilyEnabled(subscription, tariff);
    if (!subscription.isActiveAt(now)) {
      throw new DomainException(ErrorCode.SUBSCRIPTION_EXPIRED);
    }

    String handle = Handles.normalize(inviteeHandle);
    if (handle.isEmpty()) {
      throw new DomainException(ErrorCode.INVALID_HANDLE);
    }
    UserEntity invitee = users.findFirstByUsernameIgnoreCaseOrderByIdAsc(handle).orElse(null);
    if (invitee == null || invitee.getTelegramId() == null) {
      throw new DomainException(ErrorCode.INVITEE_NOT_FOUND);
    }
    if (invitee.getId().equals(owner.getId())) {
      throw new DomainException(ErrorCode.SELF_INVITE);
    }
    SubscriptionEntity inviteeSubscription = contexts.subscriptionOf(invitee.getId());
    if (inviteeSubscription != null && inviteeSubscription.isActiveAt(now)) {
      throw new DomainException(ErrorCode.INVITEE_HAS_ACTIVE_SUBSCRIPTION);
    }
    if (inAnotherFamily(invitee.getId(), null)) {
      throw new DomainException(ErrorCode.ALREADY_IN_FAMILY);
    }

    FamilyGroupEntity group = ensureGroup(owner.getId(), subscription.getId(), now);
    group = groups.findByIdForUpdate(group.getId())
        .orElseThrow(() -> new DomainException(ErrorCode.NO_FAMILY_GROUP));

    capacity.requireRoom(group.getId(), maxMembers);

    if (invites.existsByFamilyGroupIdAndInviteeUserIdAndStatus(group.getId(), invitee.getId(), InviteStatus.PENDING.code())) {
      throw new DomainException(ErrorCode.INVITE_ALREADY_PENDING);
    }

    FamilyInviteEntity invite = invites.saveAndFlush(new FamilyInviteEntity(
        group.getId(),
        invitee.getId(),
        owner.getId(),
        now,
        now.plus(props.inviteTtl())
    ));

    FamilyMemberEntity member = members.findByFamilyGroupIdAndUserId(group.getId(), invitee.getId()).orElse(null);
    if (member == null) {
      member = new FamilyMemberEntity(group.getId(), invitee.getId(), MemberStatus.INVITED, owner.getId(), now);
    } else {
      member.reinvite(owner.getId(), now);
    }
    members.saveAndFlush(member);

    audit.logUser(owner.getId(), "FAMILY_INVITE_CREATED", FamilyAuditService.TARGET_INVITE, invite.getId());
    return new InviteIssued(invite, owner, invitee);
  }

  @Transactional
  public AcceptOutcome accept(Long userId, Long inviteId) {
    Instant now = clock.instant();

    FamilyInviteEntity invite = lockInviteOf(inviteId, userId);
    if (!invite.isPending()) {
      throw new DomainException(ErrorCode.INVITE_NOT_PENDING);
    }
    if (invite.isExpiredAt(now)) {
      invite.decide(InviteStatus.EXPIRED, now);
      invites.saveAndFlush(invite);
      audit.logUser(userId, "FAMILY_INVITE_EXPIRED", FamilyAuditService.TARGET_INVITE, invite.getId());
      return new AcceptOutcome(invite, true, null, null, invite.getFamilyGroupId());
    }

    FamilyGroupEntity group = groups.findByIdForUpdate(invite.getFamilyGroupId())
        .orElseThrow(() -> new DomainException(ErrorCode.NO_FAMILY_GROUP));
    UserEntity owner = users.findById(group.getOwnerUserId()).orElse(null);
    SubscriptionEntity subscription = owner == null ? null : contexts.subscriptionOf(owner.getId());
    int maxMembers = capacity.requireFamilyEnabled(subscription, contexts.tariffOf(subscription));

    if (inAnotherFamily(userId, group.getId())) {
      throw new DomainException(ErrorCode.ALREADY_IN_FAMILY);
    }
    capacity.requireRoom(group.getId(), maxMembers);

    invite.decide(InviteStatus.ACCEPTED, now);
    invites.saveAndFlush(invite);

    FamilyMemberEntity member = members.findByFamilyGroupIdAndUserId(group.getId(), userId).orElse(null);
    if (member == null) {
      member = new FamilyMemberEntity(group.getId(), userId, MemberStatus.ACTIVE, invite.getInviterUserId(), invite.getCreatedAt());
    }
    member.activate(now);
    members.saveAndFlush(member);

    audit.logUser(userId, "FAMILY_INVITE_ACCEPTED", FamilyAuditService.TARGET_INVITE, invite.getId());
    UserEntity memberUser = users.findById(userId).orElse(null);
    return new AcceptOutcome(invite, false, memberUser, owner, group.getId());
  }

  @Transactional
  public InviteClosed decline(Long userId, Long inviteId) {
    Instant now = clock.instant();

    FamilyInviteEntity invite = lockInviteOf(inviteId, userId);
    if (!invite.isPending()) {
      throw new DomainException(ErrorCode.INVITE_NOT_PENDING);
    }
    invite.decide(InviteStatus.DECLINED, now);
    invites.saveAndFlush(invite);
    closeInvitedMember(invite.getFamilyGroupId(), userId, now);

    audit.logUser(userId, "FAMILY_INVITE_DECLINED", FamilyAuditService.TARGET_INVITE, invite.getId());
    UserEntity owner = groups.findById(invite.getFamilyGroupId())
        .flatMap(g -> users.findById(g.getOwnerUserId()))
        .orElse(null);
    return new InviteClosed(invite, users.findById(userId).orElse(null), owner);
  }

  @Transactional
  public InviteClosed revoke(Long ownerUserId, Long inviteId) {
    AccessContext ctx = contexts.resolve(ownerUserId);
    if (!ctx.isOwnerWithGroup()) {
      throw new DomainException(ErrorCode.NOT_OWNER, "Only owner can revoke invites");
    }

    FamilyInviteEntity invite = invites.findByIdForUpdate(inviteId)
        .filter(i -> i.getFamilyGroupId().equals(ctx.groupId()))
        .orElseThrow(() -> new DomainException(ErrorCode.INVITE_NOT_FOUND));
    if (!invite.isPending()) {
      throw new DomainException(ErrorCode.INVITE_NOT_PENDING);
    }

    Instant now = clock.instant();
    invite.decide(InviteStatus.REVOKED, now);
    invites.saveAndFlush(invite);
    closeInvitedMember(invite.getFamilyGroupId(), invite.getInviteeUserId(), now);

    audit.logUser(ownerUserId, "FAMILY_INVITE_REVOKED", FamilyAuditService.TARGET_INVITE, invite.getId());
    return new InviteClosed(invite, ctx.owner(), users.findById(invite.getInviteeUserId()).orElse(null));
  }

  @Transactional
  public MemberReleased removeMember(Long ownerUserId, Long memberUserId) {
    AccessContext ctx = contexts.resolve(ownerUserId);
    if (!ctx.isOwnerWithGroup()) {
      throw new DomainException(ErrorCode.NOT_OWNER, "Only owner can remove members");
    }
    if (ctx.ownerId().equals(memberUserId)) {
      throw new DomainException(ErrorCode.OWNER_SELF_REMOVE);
    }

    FamilyMemberEntity member = members.findForUpdate(ctx.groupId(), memberUserId, MemberStatus.ACTIVE.code())
        .orElseThrow(() -> new DomainException(ErrorCode.MEMBER_NOT_FOUND));
    member.close(MemberStatus.REMOVED, clock.instant());
    members.saveAndFlush(member);
    List<String> hwids = releaseDevices(ctx.groupId(), memberUserId);

    audit.logUser(ownerUserId, "FAMILY_MEMBER_REMOVED", FamilyAuditService.TARGET_MEMBER, memberUserId);
    return new MemberReleased(ctx.groupId(), ctx.owner(), users.findById(memberUserId).orElse(null), hwids);
  }

  @Transactional
  public MemberReleased leave(Long userId) {
    AccessContext ctx = contexts.resolve(userId);
    if (ctx.role() != FamilyRole.MEMBER || !ctx.hasGroup() || ctx.owner() == null) {
      throw new DomainException(ErrorCode.NOT_A_MEMBER);
    }

    FamilyMemberEntity member = members.findForUpdate(ctx.groupId(), userId, MemberStatus.ACTIVE.code())
        .orElseThrow(() -> new DomainException(ErrorCode.MEMBER_NOT_FOUND, "Active family membership not found"));
    member.close(MemberStatus.LEFT, clock.instant());
    members.saveAndFlush(member);
    List<String> hwids = releaseDevices(ctx.groupId(), userId);

    audit.logUser(userId, "FAMILY_MEMBER_LEFT", FamilyAuditService.TARGET_MEMBER, userId);
    return new MemberReleased(ctx.groupId(), ctx.owner(), ctx.requester(), hwids);
  }

  /**
   * Lazily creates the owner's group, or rebinds it when the owner's subscription row changed
   * (a renewal may create a new one).
   */
  @Transactional
  public FamilyGroupEntity ensureGroup(Long ownerUserId, Long subscriptionId, Instant now) {
    FamilyGroupEntity group = groups.findByOwnerUserId(ownerUserId).orElse(null);
    if (group == null) {
      return groups.saveAndFlush(new FamilyGroupEntity(ownerUserId, subscriptionId, now));
    }
    if (!group.getSubscriptionId().equals(subscriptionId)) {
      group.setSubscriptionId(subscriptionId);
      return groups.saveAndFlush(group);
    }
    return group;
  }

  /** Active member elsewhere, or owner of a group. The given group is ignored when not null. */
  private boolean inAnotherFamily(Long userId, Long excludedGroupId) {
    String active = MemberStatus.ACTIVE.code();
    if (excludedGroupId == null) {
      return members.existsByUserIdAndStatus(userId, active) || groups.existsByOwnerUserId(userId);
    }
    return members.existsByUserIdAndStatusAndFamilyGroupIdNot(userId, active, excludedGroupId)
        || groups.existsByOwnerUserIdAndIdNot(userId, excludedGroupId);
  }

  private FamilyInviteEntity lockInviteOf(Long inviteId, Long inviteeUserId) {
    return invites.findByIdForUpdate(inviteId)
        .filter(i -> i.getInviteeUserId().equals(inviteeUserId))
        .orElseThrow(() -> new DomainException(ErrorCode.INVITE_NOT_FOUND));
  }

  /** An invited row whose invite went away must not stay "invited". */
  private void closeInvitedMember(Long groupId, Long userId, Instant now) {
    members.findByFamilyGroupIdAndUserId(groupId, userId)
        .filter(m -> m.status() == MemberStatus.INVITED)
        .ifPresent(m -> {
          m.close(MemberStatus.DECLINED, now);
          members.saveAndFlush(m);
        });
  }

  private List<String> releaseDevices(Long groupId, Long userId) {
    List<FamilyDeviceEntity> rows = devices.findByFamilyGroupIdAndOwnerUserId(groupId, userId);
    if (rows.isEmpty()) return List.of();
    devices.deleteAll(rows);
    devices.flush();
    return rows.stream().map(FamilyDeviceEntity::getHwid).toList();
  }
}
