package com.cabinet.api.subscription;

import com.cabinet.api.family.AccessContext;
import com.cabinet.api.family.AccessContextResolver;
import com.cabinet.saas.domain.model.FamilyRole;
import com.cabinet.saas.infrastructure.subscription.SubscriptionEntity;
import com.cabinet.saas.infrastructure.tariff.TariffEntity;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EffectiveSubscriptionServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private AccessContextResolver contexts;
  private UserRepository users;
  private EffectiveSubscriptionService service;

  private UserEntity owner;
  private UserEntity member;
  private SubscriptionEntity ownerSub;
  private TariffEntity family;

  @BeforeEach
  void setUp() {
    contexts = mock(AccessContextResolver.class);
    users = mock(UserRepository.class);
    service = new EffectiveSubscriptionService(contexts, users, Clock.fixed(NOW, ZoneOffset.UTC));

    owner = user(1L, "owner");
    member = user(2L, "member");
    family = new TariffEntity("Family", true, 4, 5);
    ownerSub = new SubscriptionEntity(1L, 9L, "active", NOW.plus(Duration.ofDays(10)), 5, NOW);
    when(contexts.tariffOf(ownerSub)).thenReturn(family);
  }

  @Test
  @DisplayName("An active personal subscription wins without resolving family state")
  void personalShortCircuits() {
    SubscriptionEntity personal = new SubscriptionEntity(2L, null, "active", NOW.plus(Duration.ofDays(1)), 1, NOW);
    when(contexts.subscriptionOf(2L)).thenReturn(personal);
    when(users.findById(2L)).thenReturn(Optional.of(member));

    var result = service.resolve(2L);

    assertThat(result.active()).isTrue();
    assertThat(result.source()).isEqualTo("personal");
    assertThat(result.ownerUser().id()).isEqualTo(2L);
    assertThat(result.requesterUser().id()).isEqualTo(2L);
    assertThat(result.requesterUser().username()).isEqualTo("member");
    verify(contexts, never()).resolve(anyLong());
  }

  @Test
  @DisplayName("A member with a lapsed personal plan rides on the owner's active one")
  void memberUsesOwnerSubscription() {
    SubscriptionEntity lapsed = new SubscriptionEntity(2L, null, "expired", NOW.minus(Duration.ofDays(1)), 1, NOW);
    when(contexts.subscriptionOf(2L)).thenReturn(lapsed);
    when(contexts.resolve(2L)).thenReturn(new AccessContext(member, owner, ownerSub, family, null, FamilyRole.MEMBER));

    var result = service.resolve(2L);

    assertThat(result.active()).isTrue();
    assertThat(result.source()).isEqualTo("family_owner");
    assertThat(result.subscription().userId()).isEqualTo(1L);
    assertThat(result.tariff().name()).isEqualTo("Family");
    assertThat(result.ownerUser().id()).isEqualTo(1L);
    assertThat(result.requesterUser().id()).isEqualTo(2L);
  }

  @Test
  @DisplayName("A member of a group whose owner lapsed has no access, but sees their own plan")
  void ownerLapsed() {
    SubscriptionEntity lapsedOwner = new SubscriptionEntity(1L, 9L, "active", NOW.minus(Duration.ofHours(1)), 5, NOW);
    SubscriptionEntity lapsed = new SubscriptionEntity(2L, null, "expired", NOW.minus(Duration.ofDays(1)), 1, NOW);
    when(contexts.subscriptionOf(2L)).thenReturn(lapsed);
    when(contexts.resolve(2L)).thenReturn(new AccessContext(member, owner, lapsedOwner, family, null, FamilyRole.MEMBER));

    var result = service.resolve(2L);

    assertThat(result.active()).isFalse();
    assertThat(result.source()).isNull();
    assertThat(result.subscription().status()).isEqualTo("expired");
    assertThat(result.tariff()).isNull();
    assertThat(result.ownerUser()).isNull();
  }

  @Test
  @DisplayName("An owner whose own plan expired does not fall back to anything")
  void ownerWithoutActivePlan() {
    SubscriptionEntity lapsed = new SubscriptionEntity(1L, 9L, "expired", NOW.minus(Duration.ofDays(1)), 5, NOW);
    when(contexts.subscriptionOf(1L)).thenReturn(lapsed);
    when(contexts.resolve(1L)).thenReturn(new AccessContext(owner, owner, lapsed, family, null, FamilyRole.OWNER));

    assertThat(service.resolve(1L).active()).isFalse();
  }

  private static UserEntity user(Long id, String username) {
    UserEntity u = new UserEntity(username, 100L + id, null, NOW);
    ReflectionTestUtils.setField(u, "id", id);
    return u;
  }
}
