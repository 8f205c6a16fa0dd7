package com.cabinet.api.notification;

import com.cabinet.api.security.SecurityActor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

  private final NotificationService notifications;

  public NotificationController(NotificationService notifications) {
    this.notifications = notifications;
  }

  @GetMapping
  public NotificationService.NotificationPage list(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Integer offset
  ) {
    return notifications.list(SecurityActor.userId(jwt), limit, offset);
  }

  @PostMapping("/{id}/read")
  public NotificationService.NotificationView markRead(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
    return notifications.markRead(SecurityActor.userId(jwt), id);
  }

  @PostMapping("/read-all")
  public Map<String, Object> markAllRead(@AuthenticationPrincipal Jwt jwt) {
    int updated = notifications.markAllRead(SecurityActor.userId(jwt));
    return Map.of("success", true, "updated", updated);
  }
}
