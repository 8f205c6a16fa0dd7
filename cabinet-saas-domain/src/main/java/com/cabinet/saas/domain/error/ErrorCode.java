package com.cabinet.saas.domain.error;

/**
 * Stable, machine-readable rejection reasons.
 *
 * Conflicts found before any write report 400; the commit-time race reports 409.
 */
public enum ErrorCode {

  USER_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "User not found"),
  INVALID_ARGUMENT(ErrorKind.VALIDATION, 400, "Invalid request"),

  // family: eligibility
  NO_SUBSCRIPTION(ErrorKind.VALIDATION, 400, "No active subscription with tariff"),
  FAMILY_DISABLED(ErrorKind.VALIDATION, 400, "Family access is not available for your tariff"),
  SUBSCRIPTION_EXPIRED(ErrorKind.FORBIDDEN, 403, "Subscription expired"),

  // family: invites
  INVALID_HANDLE(ErrorKind.VALIDATION, 400, "Invalid Telegram username"),
  INVITEE_NOT_FOUND(ErrorKind.VALIDATION, 400, "User must start the bot first"),
  SELF_INVITE(ErrorKind.VALIDATION, 400, "You cannot invite yourself"),
  INVITEE_HAS_ACTIVE_SUBSCRIPTION(ErrorKind.CONFLICT, 409, "Cannot invite user with active subscription"),
  ALREADY_IN_FAMILY(ErrorKind.CONFLICT, 400, "User is already in another family"),
  CAPACITY_REACHED(ErrorKind.CONFLICT, 400, "Family member limit reached"),
  INVITE_ALREADY_PENDING(ErrorKind.CONFLICT, 400, "Invite already pending"),
  INVITE_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Invite not found"),
  INVITE_NOT_PENDING(ErrorKind.VALIDATION, 400, "Invite is not pending"),
  INVITE_EXPIRED(ErrorKind.VALIDATION, 400, "Invite expired"),
  CONFLICT_RETRY(ErrorKind.CONFLICT, 409, "Invite status conflict. Please refresh and try again."),

  // family: membership
  NOT_OWNER(ErrorKind.FORBIDDEN, 403, "Only owner can manage family"),
  OWNER_SELF_REMOVE(ErrorKind.VALIDATION, 400, "Owner cannot remove themselves"),
  MEMBER_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Active family member not found"),
  NOT_A_MEMBER(ErrorKind.VALIDATION, 400, "User is not an active family member"),
  NO_FAMILY_GROUP(ErrorKind.NOT_FOUND, 404, "Family group not found"),

  // family: devices
  DEVICE_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Device not found"),
  FORBIDDEN_DEVICE_DELETE(ErrorKind.FORBIDDEN, 403, "Family member cannot delete owner devices"),

  NOTIFICATION_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Notification not found"),

  // panel
  PANEL_NOT_CONFIGURED(ErrorKind.UPSTREAM, 503, "VPN panel is not configured"),
  PANEL_UNAVAILABLE(ErrorKind.UPSTREAM, 502, "VPN panel request failed"),

  // personal vpn
  INSTANCE_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Personal VPN instance not found"),
  INSTANCE_ALREADY_ASSIGNED(ErrorKind.CONFLICT, 409, "User already has personal VPN instance"),
  INSTANCE_NOT_ACTIVE(ErrorKind.VALIDATION, 400, "Personal VPN instance is not active"),
  NODE_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Node not found"),
  SQUAD_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Squad not found"),
  RESTART_COOLDOWN(ErrorKind.RATE_LIMITED, 429, "Node restart is available once every 10 minutes"),
  SUB_USER_LIMIT_REACHED(ErrorKind.VALIDATION, 400, "Max sub-users limit reached"),
  SUB_USER_NOT_FOUND(ErrorKind.NOT_FOUND, 404, "Sub-user not found");

  private final ErrorKind kind;
  private final int httpStatus;
  private final String defaultMessage;

  ErrorCode(ErrorKind kind, int httpStatus, String defaultMessage) {
    this.kind = kind;
    this.httpStatus = httpStatus;
    this.defaultMessage = defaultMessage;
  }

  public ErrorKind kind() { return kind; }
  public int httpStatus() { return httpStatus; }
  public String defaultMessage() { return defaultMessage; }
}
