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

import com.azure.cosmos.CosmosAsyncClient;
import com.azure.cosmos.CosmosClientBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.ConfigurationPublishAdapter;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceAdapterRegistry;
import com.firefly.provisioningengine.adapter.fabric.AccessTokenProvider;
import com.firefly.provisioningengine.adapter.fabric.FabricEventhouseAdapter;
import com.firefly.provisioningengine.adapter.fabric.FabricItemAdapter;
import com.firefly.provisioningengine.adapter.fabric.FabricOntologyAdapter;
import com.firefly.provisioningengine.adapter.fabric.FabricRestClient;
import com.firefly.provisioningengine.adapter.fabric.FabricWorkspaceAdapter;
import com.firefly.provisioningengine.adapter.fabric.GraphIndexAdapter;
import com.firefly.provisioningengine.adapter.fabric.GraphModelDiscoveryAdapter;
import com.firefly.provisioningengine.adapter.fabric.GraphModelLocator;
import com.firefly.provisioningengine.adapter.fabric.KustoRestClient;
import com.firefly.provisioningengine.adapter.fabric.KustoTableAdapter;
import com.firefly.provisioningengine.adapter.fabric.LakehouseTableAdapter;
import com.firefly.provisioningengine.adapter.fabric.OneLakeUploadAdapter;
import com.firefly.provisioningengine.adapter.fabric.StaticAccessTokenProvider;
import com.firefly.provisioningengine.adapter.inmemory.InMemoryAdapters;
import com.firefly.provisioningengine.adapter.inmemory.InMemoryResourcePlatform;
import com.firefly.provisioningengine.aop.AdapterLoggingAspect;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.ConfigurationStore;
import com.firefly.provisioningengine.configstore.EnvFileConfigurationStore;
import com.firefly.provisioningengine.configstore.InMemoryConfigurationStore;
import com.firefly.provisioningengine.dispatch.ConnectorRegistry;
import com.firefly.provisioningengine.dispatch.GraphBackend;
import com.firefly.provisioningengine.dispatch.QueryDispatcher;
import com.firefly.provisioningengine.dispatch.TelemetryBackend;
import com.firefly.provisioningengine.dispatch.ValueNormalizer;
import com.firefly.provisioningengine.dispatch.cosmos.CosmosNoSqlBackend;
import com.firefly.provisioningengine.dispatch.fabric.FabricGqlBackend;
import com.firefly.provisioningengine.dispatch.fabric.FabricKqlBackend;
import com.firefly.provisioningengine.dispatch.mock.MockQueryBackend;
import com.firefly.provisioningengine.engine.ErrorClassifier;
import com.firefly.provisioningengine.engine.IdempotencyGuard;
import com.firefly.provisioningengine.engine.OrchestratorExecutor;
import com.firefly.provisioningengine.engine.ProvisioningEngine;
import com.firefly.provisioningengine.engine.ResourceNaming;
import com.firefly.provisioningengine.engine.ResumeController;
import com.firefly.provisioningengine.engine.RunRegistry;
import com.firefly.provisioningengine.engine.TargetResolver;
import com.firefly.provisioningengine.health.FabricWorkspaceProbe;
import com.firefly.provisioningengine.health.InMemoryWorkspaceProbe;
import com.firefly.provisioningengine.health.ProvisioningHealthIndicator;
import com.firefly.provisioningengine.health.ProvisioningHealthService;
import com.firefly.provisioningengine.health.WorkspaceProbe;
import com.firefly.provisioningengine.observability.CompositeProvisioningEvents;
import com.firefly.provisioningengine.observability.ProvisioningEvents;
import com.firefly.provisioningengine.observability.ProvisioningLoggerEvents;
import com.firefly.provisioningengine.observability.ProvisioningMicrometerEvents;
import com.firefly.provisioningengine.registry.StandardStepGraph;
import com.firefly.provisioningengine.registry.StepGraph;
import com.firefly.provisioningengine.scenario.PropertiesScenarioCatalog;
import com.firefly.provisioningengine.scenario.ScenarioCatalog;
import com.firefly.provisioningengine.web.ConfigurationController;
import com.firefly.provisioningengine.web.HealthController;
import com.firefly.provisioningengine.web.ProvisioningController;
import com.firefly.provisioningengine.web.ProvisioningExceptionHandler;
import com.firefly.provisioningengine.web.QueryController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring configuration that wires the provisioning engine components.
 * Users typically activate it via {@link com.firefly.provisioningengine.annotations.EnableProvisioningEngine}.
 * Every bean backs off when the host application declares its own.
 */
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(ProvisioningEngineProperties.class)
public class ProvisioningEngineConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningEngineConfiguration.class);

    // --- shared configuration and scenarios ---

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationStore configurationStore(ProvisioningEngineProperties properties) {
        String envFile = properties.getConfig().getEnvFile();
        if (envFile == null || envFile.isBlank()) {
            log.info("No firefly.provisioning.config.env-file set. Discovered identifiers are kept in memory only");
            return new InMemoryConfigurationStore();
        }
        return new EnvFileConfigurationStore(Path.of(envFile));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationAccessor configurationAccessor(ConfigurationStore store, ProvisioningEngineProperties properties) {
        return new ConfigurationAccessor(store, staticDefaults(properties), properties.getConfig().getCacheTtl());
    }

    static Map<String, String> staticDefaults(ProvisioningEngineProperties properties) {
        ProvisioningEngineProperties.FabricProperties fabric = properties.getFabric();
        Map<String, String> defaults = new LinkedHashMap<>();
        if (fabric.getWorkspaceId() != null) defaults.put(ConfigKeys.WORKSPACE_ID, fabric.getWorkspaceId());
        if (fabric.getWorkspaceName() != null) defaults.put(ConfigKeys.WORKSPACE_NAME, fabric.getWorkspaceName());
        if (fabric.getCapacityId() != null) defaults.put(ConfigKeys.CAPACITY_ID, fabric.getCapacityId());
        return defaults;
    }

    @Bean
    @ConditionalOnMissingBean
    public ScenarioCatalog scenarioCatalog(ProvisioningEngineProperties properties) {
        return new PropertiesScenarioCatalog(properties);
    }

    // --- engine ---

    @Bean
    @ConditionalOnMissingBean
    public StepGraph provisioningStepGraph(ProvisioningEngineProperties properties) {
        return StandardStepGraph.create(properties.getStep().getRetry(), properties.getStep().getBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public ConfigurationPublishAdapter configurationPublishAdapter(ConfigurationAccessor configuration) {
        return new ConfigurationPublishAdapter(configuration);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceAdapterRegistry resourceAdapterRegistry(ObjectProvider<ResourceAdapter> adapters) {
        ResourceAdapterRegistry registry = new ResourceAdapterRegistry(adapters.orderedStream().toList());
        log.info("Resource adapters registered: {}", registry.adapters().keySet());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestratorExecutor orchestratorExecutor(ResourceAdapterRegistry adapters,
                                                     ErrorClassifier classifier,
                                                     ProvisioningEvents events,
                                                     ProvisioningEngineProperties properties) {
        ResourceNaming naming = new ResourceNaming(properties.getFabric().getWorkspaceName(), properties.getNameTemplate());
        return new OrchestratorExecutor(adapters, new IdempotencyGuard(classifier), classifier,
                new TargetResolver(naming), events, properties.getResume().isVerifyCompleted());
    }

    @Bean(destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "provisioningScheduler")
    public Scheduler provisioningScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "provisioning");
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public ProvisioningEngine provisioningEngine(StepGraph graph,
                                                 ScenarioCatalog scenarios,
                                                 ConfigurationAccessor configuration,
                                                 OrchestratorExecutor executor,
                                                 ProvisioningEvents events,
                                                 ObjectProvider<Scheduler> scheduler,
                                                 ProvisioningEngineProperties properties) {
        return new ProvisioningEngine(graph, scenarios, configuration, new RunRegistry(), new ResumeController(),
                executor, events, scheduler.getIfUnique(Schedulers::boundedElastic),
                properties.getProgress().getBufferSize());
    }

    // --- query dispatch ---

    @Bean
    @ConditionalOnMissingBean
    public MockQueryBackend mockQueryBackend() {
        return new MockQueryBackend();
    }

    @Bean
    @ConditionalOnMissingBean(name = "graphConnectorRegistry")
    public ConnectorRegistry<GraphBackend> graphConnectorRegistry(ObjectProvider<GraphBackend> backends) {
        return new ConnectorRegistry<>("graph", backends.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean(name = "telemetryConnectorRegistry")
    public ConnectorRegistry<TelemetryBackend> telemetryConnectorRegistry(ObjectProvider<TelemetryBackend> backends) {
        return new ConnectorRegistry<>("telemetry", backends.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryDispatcher queryDispatcher(ScenarioCatalog scenarios,
                                           ConnectorRegistry<GraphBackend> graphBackends,
                                           ConnectorRegistry<TelemetryBackend> telemetryBackends,
                                           ObjectProvider<ObjectMapper> mapper) {
        return new QueryDispatcher(scenarios, graphBackends, telemetryBackends,
                new ValueNormalizer(mapper.getIfAvailable(ObjectMapper::new)));
    }

    // --- health ---

    @Bean
    @ConditionalOnMissingBean
    public ProvisioningHealthService provisioningHealthService(ConfigurationAccessor configuration,
                                                               WorkspaceProbe probe,
                                                               ProvisioningEngineProperties properties) {
        return new ProvisioningHealthService(configuration, probe, properties.getHealth().getCacheTtl());
    }

    // --- observability ---

    @Bean
    public ProvisioningLoggerEvents provisioningLoggerEvents() {
        return new ProvisioningLoggerEvents();
    }

    @Bean
    @Primary
    public ProvisioningEvents provisioningEventsComposite(ProvisioningLoggerEvents logger,
                                                         ObjectProvider<ProvisioningMicrometerEvents> micrometer) {
        List<ProvisioningEvents> sinks = new ArrayList<>();
        sinks.add(logger);
        ProvisioningMicrometerEvents m = micrometer.getIfAvailable();
        if (m != null) sinks.add(m);
        return new CompositeProvisioningEvents(sinks);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerConfig {
        @Bean
        public ProvisioningMicrometerEvents provisioningMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new ProvisioningMicrometerEvents(registry);
        }
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.provisioning.adapter-logging.enabled", havingValue = "true", matchIfMissing = true)
    public AdapterLoggingAspect adapterLoggingAspect() {
        return new AdapterLoggingAspect();
    }

    // --- platforms ---

    /**
     * Simulated platform, the default. Every adapter records its create calls on the shared platform bean.
     */
    @Configuration
    @ConditionalOnProperty(name = "firefly.provisioning.platform", havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryPlatformConfig {

        @Bean
        @ConditionalOnMissingBean
        public InMemoryResourcePlatform inMemoryResourcePlatform() {
            return new InMemoryResourcePlatform();
        }

        @Bean
        @ConditionalOnMissingBean
        public WorkspaceProbe workspaceProbe(InMemoryResourcePlatform platform) {
            return new InMemoryWorkspaceProbe(platform);
        }

        @Bean
        public ResourceAdapter inMemoryWorkspaceAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.workspace(platform);
        }

        @Bean
        public ResourceAdapter inMemoryLakehouseAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.lakehouse(platform);
        }

        @Bean
        public ResourceAdapter inMemoryLakehouseFilesAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.lakehouseFiles(platform);
        }

        @Bean
        public ResourceAdapter inMemoryLakehouseTablesAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.lakehouseTables(platform);
        }

        @Bean
        public ResourceAdapter inMemoryEventhouseAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.eventhouse(platform);
        }

        @Bean
        public ResourceAdapter inMemoryTimeseriesTablesAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.timeseriesTables(platform);
        }

        @Bean
        public ResourceAdapter inMemoryOntologyAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.ontology(platform);
        }

        @Bean
        public ResourceAdapter inMemoryGraphIndexAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.graphIndex(platform);
        }

        @Bean
        public ResourceAdapter inMemoryGraphModelAdapter(InMemoryResourcePlatform platform) {
            return InMemoryAdapters.graphModel(platform);
        }
    }

    /**
     * Microsoft Fabric REST adapters and the Fabric query backends.
     */
    @Configuration
    @ConditionalOnProperty(name = "firefly.provisioning.platform", havingValue = "fabric")
    static class FabricPlatformConfig {

        @Bean
        @ConditionalOnMissingBean
        public AccessTokenProvider accessTokenProvider(ProvisioningEngineProperties properties) {
            return new StaticAccessTokenProvider(properties.getFabric().getAccessToken());
        }

        @Bean
        @ConditionalOnMissingBean
        public FabricRestClient fabricRestClient(ObjectProvider<WebClient.Builder> builder,
                                                 AccessTokenProvider tokens,
                                                 ObjectProvider<ObjectMapper> mapper,
                                                 ProvisioningEngineProperties properties) {
            ProvisioningEngineProperties.FabricProperties fabric = properties.getFabric();
            WebClient webClient = builder.getIfAvailable(WebClient::builder).clone().baseUrl(fabric.getApiUrl()).build();
            return new FabricRestClient(webClient, tokens, mapper.getIfAvailable(ObjectMapper::new),
                    fabric.getPollInterval(), fabric.getOperationTimeout());
        }

        @Bean
        @ConditionalOnMissingBean
        public KustoRestClient kustoRestClient(ObjectProvider<WebClient.Builder> builder, AccessTokenProvider tokens) {
            return new KustoRestClient(builder.getIfAvailable(WebClient::builder).clone().build(), tokens);
        }

        @Bean
        @ConditionalOnMissingBean
        public GraphModelLocator graphModelLocator(FabricRestClient client) {
            return new GraphModelLocator(client);
        }

        @Bean
        @ConditionalOnMissingBean
        public WorkspaceProbe workspaceProbe(FabricRestClient client) {
            return new FabricWorkspaceProbe(client);
        }

        @Bean
        public ResourceAdapter fabricWorkspaceAdapter(FabricRestClient client) {
            return new FabricWorkspaceAdapter(client);
        }

        @Bean
        public ResourceAdapter fabricLakehouseAdapter(FabricRestClient client) {
            return new FabricItemAdapter(client, AdapterKeys.LAKEHOUSE,
                    "lakehouses", "Lakehouse", ConfigKeys.LAKEHOUSE_ID, ConfigKeys.LAKEHOUSE_NAME);
        }

        @Bean
        public ResourceAdapter oneLakeUploadAdapter(ObjectProvider<WebClient.Builder> builder,
                                                    AccessTokenProvider tokens,
                                                    ProvisioningEngineProperties properties) {
            WebClient oneLake = builder.getIfAvailable(WebClient::builder).clone()
                    .baseUrl(properties.getFabric().getOnelakeUrl()).build();
            return new OneLakeUploadAdapter(oneLake, tokens);
        }

        @Bean
        public ResourceAdapter lakehouseTableAdapter(FabricRestClient client) {
            return new LakehouseTableAdapter(client);
        }

        @Bean
        public ResourceAdapter fabricEventhouseAdapter(FabricRestClient client) {
            return new FabricEventhouseAdapter(client);
        }

        @Bean
        public ResourceAdapter kustoTableAdapter(KustoRestClient kusto) {
            return new KustoTableAdapter(kusto);
        }

        @Bean
        public ResourceAdapter fabricOntologyAdapter(FabricRestClient client) {
            return new FabricOntologyAdapter(client);
        }

        @Bean
        public ResourceAdapter graphIndexAdapter(GraphModelLocator locator, ProvisioningEngineProperties properties) {
            return new GraphIndexAdapter(locator, properties.getIndexing().getPollInterval(),
                    properties.getIndexing().getTimeout());
        }

        @Bean
        public ResourceAdapter graphModelDiscoveryAdapter(GraphModelLocator locator) {
            return new GraphModelDiscoveryAdapter(locator);
        }

        @Bean
        public FabricGqlBackend fabricGqlBackend(FabricRestClient client, ConfigurationAccessor configuration,
                                                 ProvisioningEngineProperties properties) {
            return new FabricGqlBackend(client, configuration, properties.getQuery().getMaxRetries(),
                    properties.getQuery().getBackoff());
        }

        @Bean
        public FabricKqlBackend fabricKqlBackend(KustoRestClient kusto, ConfigurationAccessor configuration) {
            return new FabricKqlBackend(kusto, configuration);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "com.azure.cosmos.CosmosAsyncClient")
    @ConditionalOnProperty(name = "firefly.provisioning.cosmos.endpoint")
    static class CosmosConfig {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public CosmosAsyncClient cosmosAsyncClient(ProvisioningEngineProperties properties) {
            return new CosmosClientBuilder()
                    .endpoint(properties.getCosmos().getEndpoint())
                    .key(properties.getCosmos().getKey())
                    .buildAsyncClient();
        }

        @Bean
        public CosmosNoSqlBackend cosmosNoSqlBackend(CosmosAsyncClient client, ProvisioningEngineProperties properties) {
            return new CosmosNoSqlBackend(client, properties.getCosmos().getDatabase(),
                    properties.getCosmos().getMaxItems());
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class HealthIndicatorConfig {
        @Bean
        @ConditionalOnMissingBean(name = "provisioningHealthIndicator")
        public ProvisioningHealthIndicator provisioningHealthIndicator(ProvisioningHealthService service) {
            return new ProvisioningHealthIndicator(service);
        }
    }

    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    static class WebConfig {

        @Bean
        @ConditionalOnMissingBean
        public ProvisioningController provisioningController(ProvisioningEngine engine) {
            return new ProvisioningController(engine);
        }

        @Bean
        @ConditionalOnMissingBean
        public HealthController provisioningHealthController(ProvisioningHealthService health) {
            return new HealthController(health);
        }

        @Bean
        @ConditionalOnMissingBean
        public ConfigurationController configurationController(ConfigurationAccessor configuration) {
            return new ConfigurationController(configuration);
        }

        @Bean
        @ConditionalOnMissingBean
        public QueryController queryController(QueryDispatcher dispatcher) {
            return new QueryController(dispatcher);
        }

        @Bean
        @ConditionalOnMissingBean
        public ProvisioningExceptionHandler provisioningExceptionHandler() {
            return new ProvisioningExceptionHandler();
        }
    }
}
