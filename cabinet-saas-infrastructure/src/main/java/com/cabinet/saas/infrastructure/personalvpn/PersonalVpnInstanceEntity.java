package com.cabinet.saas.infrastructure.personalvpn;

import com.cabinet.saas.domain.model.InstanceStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * A panel node plus internal squad leased to one owner.
 */
@Entity
@Table(
    name = "personal_vpn_instances",
    uniqueConstraints = @UniqueConstraint(name = "uq_personal_vpn_instances_owner_user_id", columnNames = "owner_user_id")
)
public class PersonalVpnInstanceEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "owner_user_id", nullable = false)
  private Long ownerUserId;

  @Column(name = "node_uuid", nullable = false, length = 255)
  private String nodeUuid;

  @Column(name = "squad_uuid", nullable = false, length = 255)
  private String squadUuid;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "max_users", nullable = false)
  private int maxUsers;

  @Column(name = "last_restart_at")
  private Instant lastRestartAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PersonalVpnInstanceEntity() {}

  public PersonalVpnInstanceEntity(Long ownerUserId, String nodeUuid, String squadUuid, Instant expiresAt, int maxUsers, Instant createdAt) {
    this.ownerUserId = ownerUserId;
    this.nodeUuid = nodeUuid;
    this.squadUuid = squadUuid;
    this.expiresAt = expiresAt;
    this.maxUsers = maxUsers;
    this.status = InstanceStatus.ACTIVE.code();
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public Long getId() { return id; }
  public Long getOwnerUserId() { return ownerUserId; }
  public String getNodeUuid() { return nodeUuid; }
  public String getSquadUuid() { return squadUuid; }
  public Instant getExpiresAt() { return expiresAt; }
  public String getStatus() { return status; }
  public int getMaxUsers() { return maxUsers; }
  public Instant getLastRestartAt() { return lastRestartAt; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
  public void setStatus(String status) { this.status = status; }
  public void setMaxUsers(int maxUsers) { this.maxUsers = maxUsers; }
  public void setLastRestartAt(Instant lastRestartAt) { this.lastRestartAt = lastRestartAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

  public InstanceStatus effectiveStatus(Instant now) {
    return InstanceStatus.effective(status, expiresAt, now);
  }
}
