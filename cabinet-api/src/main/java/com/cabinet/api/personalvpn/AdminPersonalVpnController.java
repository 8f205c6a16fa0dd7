package com.cabinet.api.personalvpn;

import com.cabinet.api.security.SecurityActor;
import com.cabinet.application.ports.PanelPort;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/personal-vpn")
public class AdminPersonalVpnController {

  private final PersonalVpnService personalVpn;

  public AdminPersonalVpnController(PersonalVpnService personalVpn) {
    this.personalVpn = personalVpn;
  }

  public record AssignRequest(
      Long ownerUserId,
      Long ownerTelegramId,
      String ownerUsername,
      @NotBlank String nodeId,
      @NotBlank String squadId,
      @NotNull Instant expiresAt,
      @Min(1) int maxUsers
  ) {}

  public record UpdateRequest(Instant expiresAt, Integer maxUsers) {}

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public PersonalVpnService.InstanceView assign(@Valid @RequestBody AssignRequest req) {
    return personalVpn.assign(
        SecurityActor.current().actorId(),
        new PersonalVpnService.OwnerRef(req.ownerUserId(), req.ownerTelegramId(), req.ownerUsername()),
        req.nodeId().trim(),
        req.squadId().trim(),
        req.expiresAt(),
        req.maxUsers()
    );
  }

  @PatchMapping("/{instanceId}")
  public PersonalVpnService.InstanceView update(@PathVariable Long instanceId, @RequestBody UpdateRequest req) {
    return personalVpn.update(SecurityActor.current().actorId(), instanceId, req.expiresAt(), req.maxUsers());
  }

  @GetMapping("/nodes")
  public List<PanelPort.NodeInfo> nodes() {
    return personalVpn.listNodes();
  }

  @GetMapping("/squads")
  public List<PanelPort.SquadInfo> squads() {
    return personalVpn.listSquads();
  }
}
