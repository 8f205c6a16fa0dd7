package com.cabinet.saas.domain.model;

import java.util.Locale;

/**
 * Lifecycle of a (group, user) membership row.
 *
 * <pre>
 * invited --accept--> active
 * invited --decline--> declined
 * active  --leave-->   left
 * active  --remove-->  removed
 * declined | left | removed --re-invite--> invited
 * </pre>
 */
public enum MemberStatus {
  INVITED,
  ACTIVE,
  DECLINED,
  LEFT,
  REMOVED;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == DECLINED || this == LEFT || this == REMOVED;
  }

  public static MemberStatus fromCode(String code) {
    return valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
