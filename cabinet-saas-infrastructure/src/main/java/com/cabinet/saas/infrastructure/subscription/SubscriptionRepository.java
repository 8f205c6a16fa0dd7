package com.cabinet.saas.infrastructure.subscription;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, Long> {

  /** The user's personal subscription is the most recently updated row. */
  Optional<SubscriptionEntity> findTopByUserIdOrderByUpdatedAtDesc(Long userId);
}
