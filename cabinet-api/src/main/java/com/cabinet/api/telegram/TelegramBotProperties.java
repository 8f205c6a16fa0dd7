package com.cabinet.api.telegram;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Telegram bot config. The token is shared by outbound messages and the callback poller.
 *
 * Only one process may long-poll a token at a time (Telegram answers 409 otherwise),
 * so the poller is off unless enabled explicitly.
 */
@ConfigurationProperties(prefix = "cabinet.telegram.bot")
public record TelegramBotProperties(

    boolean enabled,

    String token,

    /**
     * Bot API base url; overridable for tests.
     */
    String apiBaseUrl

) {

  public String apiBaseUrlOrDefault() {
    return apiBaseUrl == null || apiBaseUrl.isBlank() ? "https://api.telegram.org" : apiBaseUrl.trim();
  }

  public boolean hasToken() {
    return token != null && !token.isBlank();
  }
}
