package com.cabinet.application.family;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HandlesTest {

  @Test
  void normalizeStripsAtAndLowercases() {
    assertThat(Handles.normalize("  @Alice ")).isEqualTo("alice");
    assertThat(Handles.normalize("BOB")).isEqualTo("bob");
    assertThat(Handles.normalize("@")).isEmpty();
    assertThat(Handles.normalize(null)).isEmpty();
  }

  @Test
  void displayNamePrefersUsernameThenTelegramId() {
    assertThat(Handles.displayName(1L, "alice", 100L)).isEqualTo("@alice");
    assertThat(Handles.displayName(1L, null, 100L)).isEqualTo("ID100");
    assertThat(Handles.displayName(1L, " ", null)).isEqualTo("User#1");
    assertThat(Handles.displayName(null, null, null)).isEqualTo("Unknown");
  }
}
