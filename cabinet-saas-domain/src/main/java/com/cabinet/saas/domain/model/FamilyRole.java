package com.cabinet.saas.domain.model;

/**
 * Position of a user relative to family sharing.
 *
 * OWNER also covers a user with a personal subscription whose group has not been created yet.
 */
public enum FamilyRole {
  OWNER,
  MEMBER,
  NONE;

  /** Wire value; NONE renders as null. */
  public String code() {
    return switch (this) {
      case OWNER -> "owner";
      case MEMBER -> "member";
      case NONE -> null;
    };
  }
}
