package com.cabinet.api.notification;

/**
 * Persisted type, realtime event type and title of each family notification.
 */
public enum NotificationType {
  FAMILY_INVITE_RECEIVED("family_invite_received", "family.invite_received", "Family invitation"),
  FAMILY_INVITE_ACCEPTED("family_invite_accepted", "family.invite_accepted", "Family invitation accepted"),
  FAMILY_INVITE_DECLINED("family_invite_declined", "family.invite_declined", "Family invitation declined"),
  FAMILY_INVITE_REVOKED("family_invite_revoked", "family.invite_revoked", "Family invitation revoked"),
  FAMILY_MEMBER_REMOVED("family_member_removed", "family.member_removed", "Removed from family"),
  FAMILY_MEMBER_LEFT("family_member_left", "family.member_left", "Family member left");

  private final String code;
  private final String realtimeType;
  private final String title;

  NotificationType(String code, String realtimeType, String title) {
    this.code = code;
    this.realtimeType = realtimeType;
    this.title = title;
  }

  public String code() { return code; }
  public String realtimeType() { return realtimeType; }
  public String title() { return title; }
}
