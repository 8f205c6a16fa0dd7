package com.cabinet.api.subscription;

import com.cabinet.api.family.AccessContext;
import com.cabinet.api.family.AccessContextResolver;
import com.cabinet.saas.domain.model.EffectiveSource;
import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.infrastructure.subscription.SubscriptionEntity;
import com.cabinet.saas.infrastructure.tariff.TariffEntity;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Decides which subscription grants a user access right now.
 *
 * An active personal subscription always wins and is returned without looking at family state;
 * the requester is then reported as its own owner.
 * Otherwise an active member rides on the owner's active subscription.
 */
@Service
public class EffectiveSubscriptionService {

  private final AccessContextResolver contexts;
  private final UserRepository users;
  private final Clock clock;

  public EffectiveSubscriptionService(AccessContextResolver contexts, UserRepository users, Clock clock) {
    this.contexts = contexts;
    this.users = users;
    this.clock = clock;
  }

  public record SubscriptionView(Long id, Long userId, Long tariffId, String status, Instant endDate, int deviceLimit) {

    static SubscriptionView of(SubscriptionEntity s) {
      return s == null ? null : new SubscriptionView(
          s.getId(), s.getUserId(), s.getTariffId(), s.getStatus(), s.getEndDate(), s.effectiveDeviceLimit());
    }
  }

  public record TariffView(Long id, String name, boolean familyEnabled, int familyMaxMembers, int deviceLimit) {

    static TariffView of(TariffEntity t) {
      return t == null ? null : new TariffView(
          t.getId(), t.getName(), t.isFamilyEnabled(), t.getFamilyMaxMembers(), t.getDeviceLimit());
    }
  }

  public record UserView(Long id, String username, Long telegramId) {

    static UserView of(UserEntity u) {
      return u == null ? null : new UserView(u.getId(), u.getUsername(), u.getTelegramId());
    }
  }

  public record EffectiveSubscription(
      boolean active,
      String source,
      SubscriptionView subscription,
      TariffView tariff,
      UserView ownerUser,
      UserView requesterUser
  ) {}

  public EffectiveSubscription resolve(Long userId) {
    Instant now = clock.instant();

    SubscriptionEntity personal = contexts.subscriptionOf(userId);
    if (personal != null && personal.isActiveAt(now)) {
      UserView requester = UserView.of(users.findById(userId).orElse(null));
      return new EffectiveSubscription(
          true,
          EffectiveSource.PERSONAL.code(),
          SubscriptionView.of(personal),
          TariffView.of(contexts.tariffOf(personal)),
          requester,
          requester
      );
    }

    AccessContext ctx = contexts.resolve(userId);
    if (ctx.role() == FamilyRole.MEMBER && ctx.subscription() != null && ctx.subscription().isActiveAt(now)) {
      return new EffectiveSubscription(
          true,
          EffectiveSource.FAMILY_OWNER.code(),
          SubscriptionView.of(ctx.subscription()),
          TariffView.of(ctx.tariff()),
          UserView.of(ctx.owner()),
          UserView.of(ctx.requester())
      );
    }

    return new EffectiveSubscription(false, null, SubscriptionView.of(personal), null, null, UserView.of(ctx.requester()));
  }
}
