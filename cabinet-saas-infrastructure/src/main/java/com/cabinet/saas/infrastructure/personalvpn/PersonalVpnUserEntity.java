package com.cabinet.saas.infrastructure.personalvpn;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "personal_vpn_users",
    uniqueConstraints = @UniqueConstraint(name = "uq_personal_vpn_users_instance_remote_user", columnNames = {"instance_id", "remote_user_uuid"}),
    indexes = @Index(name = "ix_personal_vpn_users_instance_deleted", columnList = "instance_id,deleted_at")
)
public class PersonalVpnUserEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "instance_id", nullable = false)
  private Long instanceId;

  @Column(name = "remote_user_uuid", nullable = false, length = 255)
  private String remoteUserUuid;

  @Column(name = "username", length = 255)
  private String username;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "device_limit", nullable = false)
  private int deviceLimit;

  @Column(name = "traffic_limit_bytes", nullable = false)
  private long trafficLimitBytes;

  @Column(name = "subscription_link", columnDefinition = "text")
  private String subscriptionLink;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected PersonalVpnUserEntity() {}

  public PersonalVpnUserEntity(
      Long instanceId,
      String remoteUserUuid,
      String username,
      Instant expiresAt,
      int deviceLimit,
      long trafficLimitBytes,
      String subscriptionLink,
      Instant createdAt
  ) {
    this.instanceId = instanceId;
    this.remoteUserUuid = remoteUserUuid;
    this.username = username;
    this.expiresAt = expiresAt;
    this.deviceLimit = deviceLimit;
    this.trafficLimitBytes = trafficLimitBytes;
    this.subscriptionLink = subscriptionLink;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public Long getInstanceId() { return instanceId; }
  public String getRemoteUserUuid() { return remoteUserUuid; }
  public String getUsername() { return username; }
  public Instant getExpiresAt() { return expiresAt; }
  public int getDeviceLimit() { return deviceLimit; }
  public long getTrafficLimitBytes() { return trafficLimitBytes; }
  public String getSubscriptionLink() { return subscriptionLink; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getDeletedAt() { return deletedAt; }

  public void softDelete(Instant at) { this.deletedAt = at; }
}
