package com.cabinet.saas.infrastructure.family;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Local mirror of a panel hardware registration, attributed to one family user.
 */
@Entity
@Table(
    name = "family_devices",
    uniqueConstraints = @UniqueConstraint(name = "uq_family_devices_group_hwid", columnNames = {"family_group_id", "hwid"}),
    indexes = @Index(name = "ix_family_devices_owner", columnList = "owner_user_id")
)
public class FamilyDeviceEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "family_group_id", nullable = false)
  private Long familyGroupId;

  @Column(name = "hwid", nullable = false, length = 255)
  private String hwid;

  @Column(name = "owner_user_id", nullable = false)
  private Long ownerUserId;

  @Column(name = "platform", length = 100)
  private String platform;

  @Column(name = "device_model", length = 255)
  private String deviceModel;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "last_seen_at", nullable = false)
  private Instant lastSeenAt;

  protected FamilyDeviceEntity() {}

  public FamilyDeviceEntity(Long familyGroupId, String hwid, Long ownerUserId, String platform, String deviceModel, Instant at) {
    this.familyGroupId = familyGroupId;
    this.hwid = hwid;
    this.ownerUserId = ownerUserId;
    this.platform = platform;
    this.deviceModel = deviceModel;
    this.createdAt = at;
    this.lastSeenAt = at;
  }

  public Long getId() { return id; }
  public Long getFamilyGroupId() { return familyGroupId; }
  public String getHwid() { return hwid; }
  public Long getOwnerUserId() { return ownerUserId; }
  public String getPlatform() { return platform; }
  public String getDeviceModel() { return deviceModel; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getLastSeenAt() { return lastSeenAt; }

  public void refresh(String platform, String deviceModel, Instant seenAt) {
    this.platform = platform;
    this.deviceModel = deviceModel;
    this.lastSeenAt = seenAt;
  }
}
