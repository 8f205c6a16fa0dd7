package com.cabinet.saas.domain.error;

import java.util.Locale;

public enum ErrorKind {
  VALIDATION,
  NOT_FOUND,
  CONFLICT,
  FORBIDDEN,
  UPSTREAM,
  RATE_LIMITED;

  public String reason() {
    return name().toLowerCase(Locale.ROOT);
  }
}
