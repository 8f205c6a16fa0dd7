package com.cabinet.saas.infrastructure.family;

import com.cabinet.saas.domain.model.InviteStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * At most one pending row per (group, invitee); decided rows are kept as history.
 * The pending-only uniqueness is a partial index in the migration, not expressible here.
 */
@Entity
@Table(
    name = "family_invites",
    indexes = {
        @Index(name = "ix_family_invites_invitee_status", columnList = "invitee_user_id,status"),
        @Index(name = "ix_family_invites_group_status", columnList = "family_group_id,status")
    }
)
public class FamilyInviteEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "family_group_id", nullable = false)
  private Long familyGroupId;

  @Column(name = "invitee_user_id", nullable = false)
  private Long inviteeUserId;

  @Column(name = "inviter_user_id", nullable = false)
  private Long inviterUserId;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "expires_at")
  private Instant expiresAt;

  protected FamilyInviteEntity() {}

  public FamilyInviteEntity(Long familyGroupId, Long inviteeUserId, Long inviterUserId, Instant createdAt, Instant expiresAt) {
    this.familyGroupId = familyGroupId;
    this.inviteeUserId = inviteeUserId;
    this.inviterUserId = inviterUserId;
    this.status = InviteStatus.PENDING.code();
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public Long getId() { return id; }
  public Long getFamilyGroupId() { return familyGroupId; }
  public Long getInviteeUserId() { return inviteeUserId; }
  public Long getInviterUserId() { return inviterUserId; }
  public String getStatus() { return status; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getDecidedAt() { return decidedAt; }
  public Instant getExpiresAt() { return expiresAt; }

  public boolean isPending() {
    return InviteStatus.PENDING.code().equals(status);
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  public void decide(InviteStatus outcome, Instant at) {
    if (outcome == InviteStatus.PENDING) {
      throw new IllegalArgumentException("Invite cannot be decided as pending");
    }
    this.status = outcome.code();
    this.decidedAt = at;
  }
}
