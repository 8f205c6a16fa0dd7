package com.cabinet.api.family;

import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.domain.model.MemberStatus;
import com.cabinet.saas.infrastructure.family.FamilyGroupEntity;
import com.cabinet.saas.infrastructure.family.FamilyGroupRepository;
import com.cabinet.saas.infrastructure.family.FamilyMemberEntity;
import com.cabinet.saas.infrastructure.family.FamilyMemberRepository;
import com.cabinet.saas.infrastructure.subscription.SubscriptionEntity;
import com.cabinet.saas.infrastructure.subscription.SubscriptionRepository;
import com.cabinet.saas.infrastructure.tariff.TariffEntity;
import com.cabinet.saas.infrastructure.tariff.TariffRepository;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only resolution of {@link AccessContext}. Never throws for a missing affiliation.
 *
 * Order: active membership, then owned group, then personal subscription without a group.
 */
@Service
public class AccessContextResolver {

  private final UserRepository users;
  private final SubscriptionRepository subscriptions;
  private final TariffRepository tariffs;
  private final FamilyGroupRepository groups;
  private final FamilyMemberRepository members;

  public AccessContextResolver(
      UserRepository users,
      SubscriptionRepository subscriptions,
      TariffRepository tariffs,
      FamilyGroupRepository groups,
      FamilyMemberRepository members
  ) {
    this.users = users;
    this.subscriptions = subscriptions;
    this.tariffs = tariffs;
    this.groups = groups;
    this.members = members;
  }

  public AccessContext resolve(Long userId) {
    UserEntity requester = userId == null ? null : users.findById(userId).orElse(null);
    if (requester == null) return AccessContext.none(null);

    Optional<FamilyMemberEntity> membership =
        members.findFirstByUserIdAndStatus(requester.getId(), MemberStatus.ACTIVE.code());
    if (membership.isPresent()) {
      FamilyGroupEntity group = groups.findById(membership.get().getFamilyGroupId()).orElse(null);
      UserEntity owner = group == null ? null : users.findById(group.getOwnerUserId()).orElse(null);
      if (owner != null) {
        SubscriptionEntity sub = subscriptionOf(owner.getId());
        return new AccessContext(requester, owner, sub, tariffOf(sub), group, FamilyRole.MEMBER);
      }
    }

    Optional<FamilyGroupEntity> owned = groups.findByOwnerUserId(requester.getId());
    if (owned.isPresent()) {
      SubscriptionEntity sub = subscriptionOf(requester.getId());
      return new AccessContext(requester, requester, sub, tariffOf(sub), owned.get(), FamilyRole.OWNER);
    }

    SubscriptionEntity personal = subscriptionOf(requester.getId());
    if (personal != null) {
      return new AccessContext(requester, requester, personal, tariffOf(personal), null, FamilyRole.OWNER);
    }

    return AccessContext.none(requester);
  }

  /** Current subscription row of a user (latest by update time), or null. */
  public SubscriptionEntity subscriptionOf(Long userId) {
    return subscriptions.findTopByUserIdOrderByUpdatedAtDesc(userId).orElse(null);
  }

  public TariffEntity tariffOf(SubscriptionEntity sub) {
    if (sub == null || sub.getTariffId() == null) return null;
    return tariffs.findById(sub.getTariffId()).orElse(null);
  }
}
