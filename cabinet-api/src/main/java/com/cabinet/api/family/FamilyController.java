package com.cabinet.api.family;

import com.cabinet.api.security.SecurityActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/family")
public class FamilyController {

  private final FamilyService family;
  private final FamilyOverviewService overview;
  private final FamilyDeviceService devices;

  public FamilyController(FamilyService family, FamilyOverviewService overview, FamilyDeviceService devices) {
    this.family = family;
    this.overview = overview;
    this.devices = devices;
  }

  /** Accepts {@code @name} or {@code name}, case-insensitive. */
  public record InviteRequest(
      @NotBlank @Size(min = 2, max = 255) String tgUsername
  ) {}

  @GetMapping
  public FamilyOverviewService.FamilyOverview overview(@AuthenticationPrincipal Jwt jwt) {
    return overview.overview(SecurityActor.userId(jwt));
  }

  @PostMapping("/invite")
  public FamilyService.MutationResult invite(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody InviteRequest req) {
    return family.createInvite(SecurityActor.userId(jwt), req.tgUsername());
  }

  @PostMapping("/invite/{inviteId}/revoke")
  public FamilyService.MutationResult revoke(@AuthenticationPrincipal Jwt jwt, @PathVariable Long inviteId) {
    return family.revokeInvite(SecurityActor.userId(jwt), inviteId);
  }

  @PostMapping("/invites/{inviteId}/accept")
  public FamilyService.MutationResult accept(@AuthenticationPrincipal Jwt jwt, @PathVariable Long inviteId) {
    return family.acceptInvite(SecurityActor.userId(jwt), inviteId);
  }

  @PostMapping("/invites/{inviteId}/decline")
  public FamilyService.MutationResult decline(@AuthenticationPrincipal Jwt jwt, @PathVariable Long inviteId) {
    return family.declineInvite(SecurityActor.userId(jwt), inviteId);
  }

  @PostMapping("/members/{memberUserId}/remove")
  public FamilyService.MutationResult removeMember(@AuthenticationPrincipal Jwt jwt, @PathVariable Long memberUserId) {
    return family.removeMember(SecurityActor.userId(jwt), memberUserId);
  }

  @PostMapping("/leave")
  public FamilyService.MutationResult leave(@AuthenticationPrincipal Jwt jwt) {
    return family.leave(SecurityActor.userId(jwt));
  }

  @GetMapping("/devices")
  public FamilyDeviceService.DeviceList devices(@AuthenticationPrincipal Jwt jwt) {
    return devices.list(SecurityActor.userId(jwt));
  }

  @PostMapping("/devices/sync")
  public FamilyDeviceService.DeviceList syncDevices(@AuthenticationPrincipal Jwt jwt) {
    return devices.syncFromPanel(SecurityActor.userId(jwt));
  }

  @DeleteMapping("/devices/{hwid}")
  public FamilyDeviceService.DeletionResult deleteDevice(@AuthenticationPrincipal Jwt jwt, @PathVariable String hwid) {
    return devices.deleteOne(SecurityActor.userId(jwt), hwid);
  }

  @DeleteMapping("/devices")
  public FamilyDeviceService.DeletionResult deleteAllDevices(@AuthenticationPrincipal Jwt jwt) {
    return devices.deleteAll(SecurityActor.userId(jwt));
  }
}
