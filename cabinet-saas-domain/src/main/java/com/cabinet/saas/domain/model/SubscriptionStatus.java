package com.cabinet.saas.domain.model;

import java.time.Instant;
import java.util.Locale;

public enum SubscriptionStatus {
  ACTIVE,
  TRIAL,
  DISABLED,
  EXPIRED;

  /** Unknown or missing values are treated as EXPIRED. */
  public static SubscriptionStatus parse(String v) {
    if (v == null || v.isBlank()) return EXPIRED;
    try {
      return valueOf(v.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return EXPIRED;
    }
  }

  /**
   * A subscription grants access only while it is ACTIVE and its end date is still ahead.
   */
  public static boolean isActive(String status, Instant endDate, Instant now) {
    return parse(status) == ACTIVE && endDate != null && endDate.isAfter(now);
  }
}
