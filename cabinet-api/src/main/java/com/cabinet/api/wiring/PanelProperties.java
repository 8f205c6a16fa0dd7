package com.cabinet.api.wiring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * VPN panel connection. A blank base url or token leaves the panel unconfigured:
 * device sync and personal VPN calls then fail with 503 instead of reaching out.
 */
@ConfigurationProperties(prefix = "cabinet.panel")
public record PanelProperties(
    String baseUrl,
    String apiToken,
    Integer timeoutSeconds
) {

  public int timeoutSecondsOrDefault() {
    return timeoutSeconds == null || timeoutSeconds < 1 ? 15 : timeoutSeconds;
  }
}
