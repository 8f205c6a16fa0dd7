package com.cabinet.api.health;

import com.cabinet.application.ports.PanelPort;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness for load balancers and the cabinet front-end. Reports whether the VPN panel is wired,
 * since device sync and personal VPN calls answer 503 without it.
 */
@RestController
public class HealthController {

    private final String serviceName;
    private final PanelPort panel;
    private final Clock clock;

    public HealthController(@Value("${spring.application.name:cabinet-api}") String serviceName, PanelPort panel, Clock clock) {
        this.serviceName = serviceName;
        this.panel = panel;
        this.clock = clock;
    }

    @GetMapping("/api/v1/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", serviceName);
        body.put("panel", panel.isConfigured() ? "configured" : "not_configured");
        body.put("ts", clock.instant().toString());
        return body;
    }
}
