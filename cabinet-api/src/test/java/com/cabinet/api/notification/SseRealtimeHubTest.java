package com.cabinet.api.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SseRealtimeHubTest {

  private final SseRealtimeHub hub = new SseRealtimeHub();

  @Test
  @DisplayName("Each open tab gets its own stream")
  void tracksStreamsPerUser() {
    hub.open(1L);
    hub.open(1L);
    hub.open(2L);

    assertThat(hub.openStreams(1L)).isEqualTo(2);
    assertThat(hub.openStreams(2L)).isEqualTo(1);
    assertThat(hub.openStreams(3L)).isZero();
  }

  @Test
  @DisplayName("A finished stream is dropped on the next push, the others stay")
  void dropsCompletedStream() {
    SseEmitter closed = hub.open(1L);
    hub.open(1L);
    closed.complete();

    hub.push(1L, Map.of("type", "family_invite_received", "title", "Family invitation"));

    assertThat(hub.openStreams(1L)).isEqualTo(1);
  }

  @Test
  void pushWithoutListenersIsIgnored() {
    assertThatCode(() -> hub.push(42L, Map.of("type", "family_member_left")))
        .doesNotThrowAnyException();
    assertThat(hub.openStreams(42L)).isZero();
  }
}
