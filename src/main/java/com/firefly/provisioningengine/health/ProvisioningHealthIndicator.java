/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.provisioningengine.health;

import org.springframework.boot.actuate.health.AbstractReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import reactor.core.publisher.Mono;

/**
 * Actuator view of {@link ProvisioningHealthService}: UP when the workspace is connected, UNKNOWN when nothing
 * is configured yet, DOWN otherwise.
 */
public class ProvisioningHealthIndicator extends AbstractReactiveHealthIndicator {
    private final ProvisioningHealthService service;

    public ProvisioningHealthIndicator(ProvisioningHealthService service) {
        super("Provisioning health check failed");
        this.service = service;
    }

    @Override
    protected Mono<Health> doHealthCheck(Health.Builder builder) {
        return service.health().map(status -> {
            if (!status.configured()) {
                builder.unknown();
            } else if (status.workspaceConnected()) {
                builder.up();
            } else {
                builder.down();
            }
            builder.withDetail("configured", status.configured())
                    .withDetail("workspaceConnected", status.workspaceConnected())
                    .withDetail("queryReady", status.queryReady());
            if (status.workspaceId() != null) builder.withDetail("workspaceId", status.workspaceId());
            if (status.graphModelId() != null) builder.withDetail("graphModelId", status.graphModelId());
            return builder.build();
        });
    }
}
