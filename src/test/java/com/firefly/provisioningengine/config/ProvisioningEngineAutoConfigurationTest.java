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

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.ResourceAdapterRegistry;
import com.firefly.provisioningengine.adapter.fabric.FabricRestClient;
import com.firefly.provisioningengine.adapter.inmemory.InMemoryResourcePlatform;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.EnvFileConfigurationStore;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.ProgressEvent;
import com.firefly.provisioningengine.dispatch.ConnectorRegistry;
import com.firefly.provisioningengine.dispatch.GraphBackend;
import com.firefly.provisioningengine.dispatch.QueryDispatcher;
import com.firefly.provisioningengine.dispatch.fabric.FabricGqlBackend;
import com.firefly.provisioningengine.engine.ProvisioningEngine;
import com.firefly.provisioningengine.engine.ProvisioningRequest;
import com.firefly.provisioningengine.health.InMemoryWorkspaceProbe;
import com.firefly.provisioningengine.health.ProvisioningHealthIndicator;
import com.firefly.provisioningengine.health.ProvisioningHealthService;
import com.firefly.provisioningengine.health.WorkspaceProbe;
import com.firefly.provisioningengine.observability.CompositeProvisioningEvents;
import com.firefly.provisioningengine.observability.ProvisioningEvents;
import com.firefly.provisioningengine.observability.ProvisioningMicrometerEvents;
import com.firefly.provisioningengine.web.ProvisioningController;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ReactiveWebApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProvisioningEngineAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ProvisioningEngineAutoConfiguration.class))
            .withPropertyValues(
                    "firefly.provisioning.scenarios.telco-noc.data-sources.graph.connector=fabric-gql",
                    "firefly.provisioning.scenarios.telco-noc.data-sources.telemetry.connector=fabric-kql",
                    "firefly.provisioning.scenarios.telco-noc.data-sources.telemetry.params.database=noc-db",
                    "firefly.provisioning.step.backoff=0s");

    @Test
    void inMemoryPlatformIsTheDefault() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(ProvisioningEngine.class);
            assertThat(ctx).hasSingleBean(InMemoryResourcePlatform.class);
            assertThat(ctx.getBean(WorkspaceProbe.class)).isInstanceOf(InMemoryWorkspaceProbe.class);
            assertThat(ctx).doesNotHaveBean(FabricRestClient.class);
            assertThat(ctx.getBean(ResourceAdapterRegistry.class).adapters()).containsKeys(
                    AdapterKeys.WORKSPACE, AdapterKeys.LAKEHOUSE, AdapterKeys.LAKEHOUSE_FILES,
                    AdapterKeys.LAKEHOUSE_TABLES, AdapterKeys.EVENTHOUSE, AdapterKeys.TIMESERIES_TABLES,
                    AdapterKeys.ONTOLOGY, AdapterKeys.GRAPH_INDEX, AdapterKeys.GRAPH_MODEL, AdapterKeys.CONFIGURATION);
            assertThat(ctx).hasSingleBean(QueryDispatcher.class);
            assertThat(ctx).hasSingleBean(ProvisioningHealthService.class);
            assertThat(ctx).hasSingleBean(ProvisioningHealthIndicator.class);
            assertThat(ctx.getBean(ProvisioningEvents.class)).isInstanceOf(CompositeProvisioningEvents.class);
            assertThat(ctx).doesNotHaveBean(ProvisioningController.class);
        });
    }

    @Test
    void engineProvisionsAConfiguredScenarioEndToEnd() {
        runner.run(ctx -> {
            ProvisioningEngine engine = ctx.getBean(ProvisioningEngine.class);

            List<ProgressEvent> events = engine.provision(ProvisioningRequest.of("telco-noc"))
                    .collectList().block(Duration.ofSeconds(10));

            assertThat(events).isNotEmpty();
            assertThat(events.get(events.size() - 1).status()).isEqualTo("succeeded");
            assertThat(ctx.getBean(InMemoryResourcePlatform.class).createLog())
                    .contains("workspace:fabric-demo", "lakehouse:telco-noc-lakehouse", "eventhouse:telco-noc-eventhouse");
            assertThat(ctx.getBean(ConfigurationAccessor.class).current().block().kqlDatabase()).contains("noc-db");
        });
    }

    @Test
    void disabledByProperty() {
        runner.withPropertyValues("firefly.provisioning.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(ProvisioningEngine.class));
    }

    @Test
    void envFileStoreIsUsedWhenConfigured(@TempDir Path dir) {
        runner.withPropertyValues("firefly.provisioning.config.env-file=" + dir.resolve("azure_config.env"),
                        "firefly.provisioning.fabric.workspace-id=ws-static")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(EnvFileConfigurationStore.class);
                    assertThat(ctx.getBean(ConfigurationAccessor.class).current().block().workspaceId())
                            .contains("ws-static");
                });
    }

    @Test
    void fabricPlatformWiresRestAdaptersAndQueryBackends() {
        runner.withPropertyValues("firefly.provisioning.platform=fabric",
                        "firefly.provisioning.fabric.access-token=token")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(FabricRestClient.class);
                    assertThat(ctx).hasSingleBean(FabricGqlBackend.class);
                    assertThat(ctx).doesNotHaveBean(InMemoryResourcePlatform.class);
                    @SuppressWarnings("unchecked")
                    ConnectorRegistry<GraphBackend> graph = ctx.getBean("graphConnectorRegistry", ConnectorRegistry.class);
                    assertThat(graph.connectors()).contains(Connectors.FABRIC_GQL, Connectors.MOCK);
                    assertThat(ctx.getBean(ResourceAdapterRegistry.class).adapters()).hasSize(10);
                });
    }

    @Test
    void meterRegistryEnablesMicrometerEvents() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(ProvisioningMicrometerEvents.class);
                    CompositeProvisioningEvents events = (CompositeProvisioningEvents) ctx.getBean(ProvisioningEvents.class);
                    assertThat(events.delegates()).hasSize(2);
                });
    }

    @Test
    void webEndpointsInAReactiveApplication() {
        new ReactiveWebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ProvisioningEngineAutoConfiguration.class))
                .run(ctx -> assertThat(ctx).hasSingleBean(ProvisioningController.class));
    }

    @Test
    void staticDefaultsCarryFabricSettings() {
        ProvisioningEngineProperties properties = new ProvisioningEngineProperties();
        properties.getFabric().setWorkspaceId("ws-1");
        properties.getFabric().setCapacityId("cap-1");

        assertThat(ProvisioningEngineConfiguration.staticDefaults(properties))
                .containsEntry(ConfigKeys.WORKSPACE_ID, "ws-1")
                .containsEntry(ConfigKeys.WORKSPACE_NAME, "fabric-demo")
                .containsEntry(ConfigKeys.CAPACITY_ID, "cap-1");
    }
}
