package com.cabinet.saas.domain.model;

import java.time.Instant;
import java.util.Locale;

/** Status of a personal VPN instance leased to an owner. */
public enum InstanceStatus {
  ACTIVE,
  EXPIRED,
  SUSPENDED;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static InstanceStatus fromCode(String code) {
    if (code == null || code.isBlank()) return ACTIVE;
    return valueOf(code.trim().toUpperCase(Locale.ROOT));
  }

  /** Stored ACTIVE turns into EXPIRED once the lease end has passed. */
  public static InstanceStatus effective(String stored, Instant expiresAt, Instant now) {
    InstanceStatus st = fromCode(stored);
    if (st != ACTIVE) return st;
    return now.isAfter(expiresAt) ? EXPIRED : ACTIVE;
  }
}
