package com.cabinet.saas.infrastructure.family;

import com.cabinet.saas.domain.model.MemberStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * (group, user) pairing. Status changes reuse the row; re-inviting a departed user resets it.
 */
@Entity
@Table(
    name = "family_members",
    uniqueConstraints = @UniqueConstraint(name = "uq_family_members_group_user", columnNames = {"family_group_id", "user_id"}),
    indexes = @Index(name = "ix_family_members_user_status", columnList = "user_id,status")
)
public class FamilyMemberEntity {

  public static final String ROLE_MEMBER = "member";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "family_group_id", nullable = false)
  private Long familyGroupId;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "invited_by_user_id")
  private Long invitedByUserId;

  @Column(name = "invited_at", nullable = false)
  private Instant invitedAt;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "removed_at")
  private Instant removedAt;

  protected FamilyMemberEntity() {}

  public FamilyMemberEntity(Long familyGroupId, Long userId, MemberStatus status, Long invitedByUserId, Instant invitedAt) {
    this.familyGroupId = familyGroupId;
    this.userId = userId;
    this.role = ROLE_MEMBER;
    this.status = status.code();
    this.invitedByUserId = invitedByUserId;
    this.invitedAt = invitedAt;
  }

  public Long getId() { return id; }
  public Long getFamilyGroupId() { return familyGroupId; }
  public Long getUserId() { return userId; }
  public String getRole() { return role; }
  public String getStatus() { return status; }
  public Long getInvitedByUserId() { return invitedByUserId; }
  public Instant getInvitedAt() { return invitedAt; }
  public Instant getAcceptedAt() { return acceptedAt; }
  public Instant getRemovedAt() { return removedAt; }

  public MemberStatus status() {
    return MemberStatus.fromCode(status);
  }

  public void reinvite(Long invitedBy, Instant at) {
    this.status = MemberStatus.INVITED.code();
    this.role = ROLE_MEMBER;
    this.invitedByUserId = invitedBy;
    this.invitedAt = at;
    this.removedAt = null;
  }

  public void activate(Instant at) {
    this.status = MemberStatus.ACTIVE.code();
    this.acceptedAt = at;
    this.removedAt = null;
  }

  /** declined, left or removed */
  public void close(MemberStatus terminal, Instant at) {
    if (!terminal.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal member status: " + terminal);
    }
    this.status = terminal.code();
    this.removedAt = at;
  }
}
