package com.cabinet.api.family;

import com.cabinet.api.metrics.FamilyMetrics;
import com.cabinet.api.notification.NotificationFanout;
import com.cabinet.api.notification.NotificationType;
import com.cabinet.application.ports.MessengerPort;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.infrastructure.family.FamilyInviteEntity;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Public membership operations.
 *
 * Deliberately not transactional: each call runs one {@link FamilyMembershipTransitions} transaction,
 * and only after it committed does it fan out notifications, clean up remote devices and seed
 * device attribution. Those follow-ups are best-effort.
 */
@Service
public class FamilyService {

  private static final Logger log = LoggerFactory.getLogger(FamilyService.class);

  public static final String CALLBACK_ACCEPT = "family_invite:accept:";
  public static final String CALLBACK_DECLINE = "family_invite:decline:";

  private final FamilyMembershipTransitions transitions;
  private final FamilyDeviceService deviceService;
  private final DeviceReconciler reconciler;
  private final NotificationFanout fanout;
  private final FamilyMetrics metrics;

  public FamilyService(
      FamilyMembershipTransitions transitions,
      FamilyDeviceService deviceService,
      DeviceReconciler reconciler,
      NotificationFanout fanout,
      FamilyMetrics metrics
  ) {
    this.transitions = transitions;
    this.deviceService = deviceService;
    this.reconciler = reconciler;
    this.fanout = fanout;
    this.metrics = metrics;
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record MutationResult(boolean success, Long inviteId, String status) {

    static MutationResult of(FamilyInviteEntity invite) {
      return new MutationResult(true, invite.getId(), invite.getStatus());
    }

    static MutationResult ok() {
      return new MutationResult(true, null, null);
    }
  }

  public MutationResult createInvite(Long ownerUserId, String inviteeHandle) {
    var issued = guarded("create_invite", () -> transitions.createInvite(ownerUserId, inviteeHandle));
    metrics.incInvitesCreated();
    FamilyInviteEntity invite = issued.invite();
    log.info("Family invite created: invite={} group={} owner={} invitee={}",
        invite.getId(), invite.getFamilyGroupId(), ownerUserId, issued.invitee().getId());

    String body = "You were invited to family access by " + DisplayNames.of(issued.owner()) + ". Accept?";
    fanout.notify(issued.invitee().getId(), NotificationType.FAMILY_INVITE_RECEIVED, body,
        payload("invite_id", invite.getId(), "owner_user_id", ownerUserId));
    fanout.message(issued.invitee().getTelegramId(), body, List.of(
        new MessengerPort.Action("Accept", CALLBACK_ACCEPT + invite.getId()),
        new MessengerPort.Action("Decline", CALLBACK_DECLINE + invite.getId())
    ));
    return MutationResult.of(invite);
  }

  public MutationResult acceptInvite(Long userId, Long inviteId) {
    var outcome = guarded("accept_invite", () -> transitions.accept(userId, inviteId));
    if (outcome.expired()) {
      log.info("Family invite expired on accept: invite={} user={}", inviteId, userId);
      throw new DomainException(ErrorCode.INVITE_EXPIRED);
    }
    metrics.incInvitesAccepted();
    log.info("Family invite accepted: invite={} group={} member={}", inviteId, outcome.groupId(), userId);

    deviceService.trySeedAfterAccept(outcome.groupId(), outcome.owner());

    UserEntity owner = outcome.owner();
    if (owner != null) {
      String body = DisplayNames.of(outcome.member()) + " accepted your family invitation.";
      fanout.notify(owner.getId(), NotificationType.FAMILY_INVITE_ACCEPTED, body,
          payload("invite_id", inviteId, "member_user_id", userId));
      fanout.message(owner.getTelegramId(), body, List.of());
    }
    return MutationResult.of(outcome.invite());
  }

  public MutationResult declineInvite(Long userId, Long inviteId) {
    var closed = guarded("decline_invite", () -> transitions.decline(userId, inviteId));
    log.info("Family invite declined: invite={} user={}", inviteId, userId);

    UserEntity owner = closed.counterpart();
    if (owner != null) {
      String body = DisplayNames.of(closed.actor()) + " declined your family invitation.";
      fanout.notify(owner.getId(), NotificationType.FAMILY_INVITE_DECLINED, body,
          payload("invite_id", inviteId, "member_user_id", userId));
      fanout.message(owner.getTelegramId(), body, List.of());
    }
    return MutationResult.of(closed.invite());
  }

  public MutationResult revokeInvite(Long ownerUserId, Long inviteId) {
    var closed = guarded("revoke_invite", () -> transitions.revoke(ownerUserId, inviteId));
    log.info("Family invite revoked: invite={} owner={}", inviteId, ownerUserId);

    UserEntity invitee = closed.counterpart();
    if (invitee != null) {
      String body = "Your family invitation from " + DisplayNames.of(closed.actor()) + " was revoked.";
      fanout.notify(invitee.getId(), NotificationType.FAMILY_INVITE_REVOKED, body,
          payload("invite_id", inviteId, "owner_user_id", ownerUserId));
      fanout.message(invitee.getTelegramId(), body, List.of());
    }
    return MutationResult.of(closed.invite());
  }

  public MutationResult removeMember(Long ownerUserId, Long memberUserId) {
    var released = guarded("remove_member", () -> transitions.removeMember(ownerUserId, memberUserId));
    log.info("Family member removed: group={} owner={} member={} devices={}",
        released.groupId(), ownerUserId, memberUserId, released.releasedHwids().size());
    reconciler.purgeRemote(released.owner().getPanelUuid(), released.releasedHwids());

    String body = "You were removed from family access by " + DisplayNames.of(released.owner()) + ".";
    fanout.notify(memberUserId, NotificationType.FAMILY_MEMBER_REMOVED, body, payload("owner_user_id", ownerUserId));
    if (released.member() != null) {
      fanout.message(released.member().getTelegramId(), body, List.of());
    }
    return MutationResult.ok();
  }

  public MutationResult leave(Long userId) {
    var released = guarded("leave", () -> transitions.leave(userId));
    log.info("Family member left: group={} member={} devices={}",
        released.groupId(), userId, released.releasedHwids().size());
    reconciler.purgeRemote(released.owner().getPanelUuid(), released.releasedHwids());

    String body = DisplayNames.of(released.member()) + " left your family access.";
    fanout.notify(released.owner().getId(), NotificationType.FAMILY_MEMBER_LEFT, body, payload("member_user_id", userId));
    fanout.message(released.owner().getTelegramId(), body, List.of());
    return MutationResult.ok();
  }

  /**
   * A concurrent transition on the same rows can still fail at flush or commit (unique pending
   * invite, unique membership pair, lock timeout). Those become a retryable 409.
   */
  private <T> T guarded(String operation, Supplier<T> transition) {
    try {
      return transition.get();
    } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
      metrics.incConflicts();
      log.warn("Family {} rejected by a concurrent change: {}", operation, e.getMostSpecificCause().getMessage());
      throw new DomainException(ErrorCode.CONFLICT_RETRY, ErrorCode.CONFLICT_RETRY.defaultMessage(), e);
    }
  }

  private static Map<String, Object> payload(Object... kv) {
    Map<String, Object> m = new HashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      m.put(String.valueOf(kv[i]), kv[i + 1]);
    }
    return m;
  }
}
