package com.cabinet.saas.infrastructure.family;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One per owner and one per subscription. Members, invites and devices reference it by id and are
 * removed with it (ON DELETE CASCADE in the schema).
 */
@Entity
@Table(
    name = "family_groups",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_family_groups_owner", columnNames = "owner_user_id"),
        @UniqueConstraint(name = "uq_family_groups_subscription", columnNames = "subscription_id")
    }
)
public class FamilyGroupEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "owner_user_id", nullable = false)
  private Long ownerUserId;

  @Column(name = "subscription_id", nullable = false)
  private Long subscriptionId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected FamilyGroupEntity() {}

  public FamilyGroupEntity(Long ownerUserId, Long subscriptionId, Instant createdAt) {
    this.ownerUserId = ownerUserId;
    this.subscriptionId = subscriptionId;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public Long getOwnerUserId() { return ownerUserId; }
  public Long getSubscriptionId() { return subscriptionId; }
  public Instant getCreatedAt() { return createdAt; }

  public void setSubscriptionId(Long subscriptionId) { this.subscriptionId = subscriptionId; }
}
