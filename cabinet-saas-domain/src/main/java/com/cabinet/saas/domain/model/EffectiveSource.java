package com.cabinet.saas.domain.model;

/** Where a user's current access comes from. */
public enum EffectiveSource {
  PERSONAL("personal"),
  FAMILY_OWNER("family_owner");

  private final String code;

  EffectiveSource(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
