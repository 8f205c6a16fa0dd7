package com.cabinet.application.family;

import java.util.Locale;

/**
 * Messenger handle rules shared by invite lookup and display.
 */
public final class Handles {

  private Handles() {}

  /** "  @Alice " -> "alice". Returns "" for null or blank input. */
  public static String normalize(String raw) {
    String v = raw == null ? "" : raw.trim();
    if (v.startsWith("@")) v = v.substring(1);
    return v.toLowerCase(Locale.ROOT).trim();
  }

  public static String displayName(Long userId, String username, Long telegramId) {
    if (userId == null && username == null && telegramId == null) return "Unknown";
    if (username != null && !username.isBlank()) return "@" + username;
    if (telegramId != null) return "ID" + telegramId;
    return "User#" + userId;
  }
}
