package com.cabinet.saas.infrastructure.subscription;

import com.cabinet.saas.domain.model.SubscriptionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(
    name = "subscriptions",
    indexes = {
        @Index(name = "ix_subscriptions_user", columnList = "user_id"),
        @Index(name = "ix_subscriptions_status", columnList = "status")
    }
)
public class SubscriptionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "tariff_id")
  private Long tariffId;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "end_date")
  private Instant endDate;

  @Column(name = "device_limit")
  private Integer deviceLimit;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SubscriptionEntity() {}

  public SubscriptionEntity(
      Long userId,
      Long tariffId,
      String status,
      Instant endDate,
      Integer deviceLimit,
      Instant updatedAt
  ) {
    this.userId = userId;
    this.tariffId = tariffId;
    this.status = status;
    this.endDate = endDate;
    this.deviceLimit = deviceLimit;
    this.updatedAt = updatedAt;
  }

  public Long getId() { return id; }
  public Long getUserId() { return userId; }
  public Long getTariffId() { return tariffId; }
  public String getStatus() { return status; }
  public Instant getEndDate() { return endDate; }
  public Integer getDeviceLimit() { return deviceLimit; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setStatus(String status) { this.status = status; }
  public void setEndDate(Instant endDate) { this.endDate = endDate; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

  public boolean isActiveAt(Instant now) {
    return SubscriptionStatus.isActive(status, endDate, now);
  }

  /** Devices allowed on this subscription; 1 when unset. */
  public int effectiveDeviceLimit() {
    return deviceLimit == null || deviceLimit < 1 ? 1 : deviceLimit;
  }
}
