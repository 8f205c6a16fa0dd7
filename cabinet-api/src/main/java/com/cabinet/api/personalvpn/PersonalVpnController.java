package com.cabinet.api.personalvpn;

import com.cabinet.api.security.SecurityActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/personal-vpn")
public class PersonalVpnController {

  private final PersonalVpnService personalVpn;

  public PersonalVpnController(PersonalVpnService personalVpn) {
    this.personalVpn = personalVpn;
  }

  public record CreateSubUserRequest(
      @NotNull Instant expiresAt,
      @Min(1) int deviceLimit,
      @PositiveOrZero double trafficLimitGb
  ) {}

  @GetMapping
  public PersonalVpnService.Overview overview(@AuthenticationPrincipal Jwt jwt) {
    return personalVpn.overview(SecurityActor.userId(jwt));
  }

  @PostMapping("/restart")
  public PersonalVpnService.InstanceView restart(@AuthenticationPrincipal Jwt jwt) {
    return personalVpn.restartNode(SecurityActor.userId(jwt));
  }

  @PostMapping("/users")
  @ResponseStatus(HttpStatus.CREATED)
  public PersonalVpnService.SubUserView createSubUser(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateSubUserRequest req) {
    return personalVpn.createSubUser(SecurityActor.userId(jwt), req.expiresAt(), req.deviceLimit(), req.trafficLimitGb());
  }

  @DeleteMapping("/users/{subUserId}")
  public Map<String, Object> deleteSubUser(@AuthenticationPrincipal Jwt jwt, @PathVariable Long subUserId) {
    personalVpn.deleteSubUser(SecurityActor.userId(jwt), subUserId);
    return Map.of("success", true);
  }
}
