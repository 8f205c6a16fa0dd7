package com.cabinet.saas.infrastructure.notification;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "user_notifications",
    indexes = @Index(name = "ix_user_notifications_user_read", columnList = "user_id,read_at")
)
public class UserNotificationEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "notification_type", nullable = false, length = 50)
  private String notificationType;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "body", columnDefinition = "text")
  private String body;

  /** JSON object, serialized by the caller. */
  @Column(name = "payload", columnDefinition = "text")
  private String payload;

  @Column(name = "read_at")
  private Instant readAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected UserNotificationEntity() {}

  public UserNotificationEntity(Long userId, String notificationType, String title, String body, String payload, Instant createdAt) {
    this.userId = userId;
    this.notificationType = notificationType;
    this.title = title;
    this.body = body;
    this.payload = payload;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public Long getUserId() { return userId; }
  public String getNotificationType() { return notificationType; }
  public String getTitle() { return title; }
  public String getBody() { return body; }
  public String getPayload() { return payload; }
  public Instant getReadAt() { return readAt; }
  public Instant getCreatedAt() { return createdAt; }

  public boolean isRead() {
    return readAt != null;
  }

  public void markRead(Instant at) {
    if (readAt == null) readAt = at;
  }
}
