package com.cabinet.api.family;

import com.cabinet.application.family.CapacityPolicy;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.domain.model.MemberStatus;
import com.cabinet.saas.infrastructure.family.FamilyMemberRepository;
import com.cabinet.saas.infrastructure.subscription.SubscriptionEntity;
import com.cabinet.saas.infrastructure.tariff.TariffEntity;
import org.springframework.stereotype.Component;

/**
 * Tariff eligibility and slot checks. {@link #requireRoom} is only meaningful while the caller
 * holds the group row lock; that lock is what serializes concurrent invites and accepts.
 */
@Component
public class CapacityEnforcer {

  private final FamilyMemberRepository members;

  public CapacityEnforcer(FamilyMemberRepository members) {
    this.members = members;
  }

  /** @return the tariff's member limit, owner included */
  public int requireFamilyEnabled(SubscriptionEntity subscription, TariffEntity tariff) {
    if (subscription == null || tariff == null) {
      throw new DomainException(ErrorCode.NO_SUBSCRIPTION);
    }
    if (!CapacityPolicy.familyAvailable(tariff.isFamilyEnabled(), tariff.getFamilyMaxMembers())) {
      throw new DomainException(ErrorCode.FAMILY_DISABLED);
    }
    return tariff.getFamilyMaxMembers();
  }

  public long activeCount(Long groupId) {
    return members.countByFamilyGroupIdAndStatus(groupId, MemberStatus.ACTIVE.code());
  }

  public void requireRoom(Long groupId, int maxMembersIncludingOwner) {
    if (!CapacityPolicy.hasRoom(activeCount(groupId), maxMembersIncludingOwner)) {
      throw new DomainException(ErrorCode.CAPACITY_REACHED);
    }
  }
}
