package com.cabinet.api.family;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "cabinet.family")
public record FamilyProperties(Duration inviteTtl) {

  public static final Duration DEFAULT_INVITE_TTL = Duration.ofDays(7);

  public FamilyProperties {
    if (inviteTtl == null || inviteTtl.isZero() || inviteTtl.isNegative()) {
      inviteTtl = DEFAULT_INVITE_TTL;
    }
  }
}
