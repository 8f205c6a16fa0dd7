package com.cabinet.api.family;

import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.infrastructure.family.FamilyGroupEntity;
import com.cabinet.saas.infrastructure.subscription.SubscriptionEntity;
import com.cabinet.saas.infrastructure.tariff.TariffEntity;
import com.cabinet.saas.infrastructure.user.UserEntity;

/**
 * A user's position relative to family sharing, with the owner-side records already loaded.
 *
 * For MEMBER the subscription and tariff are the owner's. For OWNER the group may still be null
 * (created on first invite). For NONE everything except the requester is null, and the
 * requester too when the user does not exist.
 */
public record AccessContext(
    UserEntity requester,
    UserEntity owner,
    SubscriptionEntity subscription,
    TariffEntity tariff,
    FamilyGroupEntity group,
    FamilyRole role
) {

  public static AccessContext none(UserEntity requester) {
    return new AccessContext(requester, null, null, null, null, FamilyRole.NONE);
  }

  public boolean hasGroup() {
    return group != null;
  }

  public Long groupId() {
    return group == null ? null : group.getId();
  }

  public Long ownerId() {
    return owner == null ? null : owner.getId();
  }

  public boolean isOwnerWithGroup() {
    return role == FamilyRole.OWNER && group != null && owner != null;
  }
}
