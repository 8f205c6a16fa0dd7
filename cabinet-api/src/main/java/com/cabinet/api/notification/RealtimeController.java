package com.cabinet.api.notification;

import com.cabinet.api.security.SecurityActor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
public class RealtimeController {

  private static final Logger log = LoggerFactory.getLogger(RealtimeController.class);

  private final SseRealtimeHub hub;

  public RealtimeController(SseRealtimeHub hub) {
    this.hub = hub;
  }

  @GetMapping(value = "/api/v1/realtime/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@AuthenticationPrincipal Jwt jwt) {
    Long userId = SecurityActor.userId(jwt);
    log.debug("Opening realtime stream for user {}", userId);
    return hub.open(userId);
  }
}
