package com.cabinet.saas.infrastructure.user;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "users",
    uniqueConstraints = @UniqueConstraint(name = "uk_users_telegram_id", columnNames = "telegram_id"),
    indexes = @Index(name = "ix_users_username", columnList = "username")
)
public class UserEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "username", length = 255)
  private String username;

  @Column(name = "telegram_id")
  private Long telegramId;

  /** Identity on the VPN panel; null until the user has been provisioned there. */
  @Column(name = "panel_uuid", length = 64)
  private String panelUuid;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected UserEntity() {}

  public UserEntity(String username, Long telegramId, String panelUuid, Instant createdAt) {
    this.username = username;
    this.telegramId = telegramId;
    this.panelUuid = panelUuid;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public String getUsername() { return username; }
  public Long getTelegramId() { return telegramId; }
  public String getPanelUuid() { return panelUuid; }
  public Instant getCreatedAt() { return createdAt; }

  public void setUsername(String username) { this.username = username; }
  public void setTelegramId(Long telegramId) { this.telegramId = telegramId; }
  public void setPanelUuid(String panelUuid) { this.panelUuid = panelUuid; }
}
