package com.firefly.provisioningengine.web;

import com.firefly.provisioningengine.health.HealthStatus;
import com.firefly.provisioningengine.health.ProvisioningHealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class HealthController {
    private final ProvisioningHealthService health;

    public HealthController(ProvisioningHealthService health) {
        this.health = health;
    }

    @GetMapping("/api/provisioning/health")
    public Mono<HealthStatus> health() {
        return health.health();
    }
}
