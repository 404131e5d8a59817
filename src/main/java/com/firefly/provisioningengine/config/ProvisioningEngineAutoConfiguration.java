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

package com.firefly.provisioningengine.config;

import com.firefly.provisioningengine.engine.ProvisioningEngine;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Auto-configuration for the provisioning engine. Applies {@link ProvisioningEngineConfiguration} unless the
 * application already imported it through {@code @EnableProvisioningEngine} or set
 * {@code firefly.provisioning.enabled=false}.
 */
@AutoConfiguration(after = {JacksonAutoConfiguration.class, WebClientAutoConfiguration.class},
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(ProvisioningEngine.class)
@ConditionalOnMissingBean(ProvisioningEngineConfiguration.class)
@ConditionalOnProperty(name = "firefly.provisioning.enabled", havingValue = "true", matchIfMissing = true)
@Import(ProvisioningEngineConfiguration.class)
public class ProvisioningEngineAutoConfiguration {
}
