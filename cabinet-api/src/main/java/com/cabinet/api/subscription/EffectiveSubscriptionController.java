package com.cabinet.api.subscription;

import com.cabinet.api.security.SecurityActor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/subscription")
public class EffectiveSubscriptionController {

  private final EffectiveSubscriptionService effective;

  public EffectiveSubscriptionController(EffectiveSubscriptionService effective) {
    this.effective = effective;
  }

  @GetMapping("/effective")
  public EffectiveSubscriptionService.EffectiveSubscription effective(@AuthenticationPrincipal Jwt jwt) {
    return effective.resolve(SecurityActor.userId(jwt));
  }
}
