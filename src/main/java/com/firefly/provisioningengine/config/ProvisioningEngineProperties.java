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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the provisioning engine.
 *
 * Example configuration:
 * <pre>
 * firefly.provisioning.platform=fabric
 * firefly.provisioning.fabric.workspace-name=noc-demo
 * firefly.provisioning.fabric.capacity-id=...
 * firefly.provisioning.resume.verify-completed=true
 * firefly.provisioning.config.env-file=./azure_config.env
 * firefly.provisioning.scenarios.telco-noc.data-sources.graph.connector=fabric-gql
 * firefly.provisioning.scenarios.telco-noc.data-sources.telemetry.connector=fabric-kql
 * firefly.provisioning.scenarios.telco-noc.data-sources.graph.params.entities-dir=data/telco-noc/entities
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.provisioning")
public class ProvisioningEngineProperties {

    public enum Platform { IN_MEMORY, FABRIC }

    /**
     * Which adapter family provisions resources.
     */
    private Platform platform = Platform.IN_MEMORY;

    /**
     * Template for derived resource names. {@code {scenario}} and {@code {kind}} are substituted.
     */
    private String nameTemplate = "{scenario}-{kind}";

    @NestedConfigurationProperty
    private FabricProperties fabric = new FabricProperties();

    @NestedConfigurationProperty
    private IndexingProperties indexing = new IndexingProperties();

    @NestedConfigurationProperty
    private ProgressProperties progress = new ProgressProperties();

    @NestedConfigurationProperty
    private ResumeProperties resume = new ResumeProperties();

    @NestedConfigurationProperty
    private StepProperties step = new StepProperties();

    @NestedConfigurationProperty
    private ConfigStoreProperties config = new ConfigStoreProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private CosmosProperties cosmos = new CosmosProperties();

    @NestedConfigurationProperty
    private QueryProperties query = new QueryProperties();

    @NestedConfigurationProperty
    private AdapterLoggingProperties adapterLogging = new AdapterLoggingProperties();

    /**
     * Materialized scenario manifests, keyed by scenario id.
     */
    private Map<String, ScenarioProperties> scenarios = new LinkedHashMap<>();

    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public String getNameTemplate() { return nameTemplate; }
    public void setNameTemplate(String nameTemplate) { this.nameTemplate = nameTemplate; }

    public FabricProperties getFabric() { return fabric; }
    public void setFabric(FabricProperties fabric) { this.fabric = fabric; }

    public IndexingProperties getIndexing() { return indexing; }
    public void setIndexing(IndexingProperties indexing) { this.indexing = indexing; }

    public ProgressProperties getProgress() { return progress; }
    public void setProgress(ProgressProperties progress) { this.progress = progress; }

    public ResumeProperties getResume() { return resume; }
    public void setResume(ResumeProperties resume) { this.resume = resume; }

    public StepProperties getStep() { return step; }
    public void setStep(StepProperties step) { this.step = step; }

    public ConfigStoreProperties getConfig() { return config; }
    public void setConfig(ConfigStoreProperties config) { this.config = config; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public CosmosProperties getCosmos() { return cosmos; }
    public void setCosmos(CosmosProperties cosmos) { this.cosmos = cosmos; }

    public QueryProperties getQuery() { return query; }
    public void setQuery(QueryProperties query) { this.query = query; }

    public AdapterLoggingProperties getAdapterLogging() { return adapterLogging; }
    public void setAdapterLogging(AdapterLoggingProperties adapterLogging) { this.adapterLogging = adapterLogging; }

    public Map<String, ScenarioProperties> getScenarios() { return scenarios; }
    public void setScenarios(Map<String, ScenarioProperties> scenarios) { this.scenarios = scenarios; }

    /**
     * Microsoft Fabric endpoints, credentials and static defaults for discovered ids.
     */
    public static class FabricProperties {
        private String apiUrl = "https://api.fabric.microsoft.com/v1";
        private String onelakeUrl = "https://onelake.dfs.fabric.microsoft.com";
        /**
         * Bearer token used for every Fabric, OneLake and Kusto call.
         */
        private String accessToken;
        private String workspaceId;
        private String workspaceName = "fabric-demo";
        private String capacityId;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration operationTimeout = Duration.ofMinutes(10);

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        public String getOnelakeUrl() { return onelakeUrl; }
        public void setOnelakeUrl(String onelakeUrl) { this.onelakeUrl = onelakeUrl; }

        public String getAccessToken() { return accessToken; }
        public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

        public String getWorkspaceId() { return workspaceId; }
        public void setWorkspaceId(String workspaceId) { this.workspaceId = workspaceId; }

        public String getWorkspaceName() { return workspaceName; }
        public void setWorkspaceName(String workspaceName) { this.workspaceName = workspaceName; }

        public String getCapacityId() { return capacityId; }
        public void setCapacityId(String capacityId) { this.capacityId = capacityId; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public Duration getOperationTimeout() { return operationTimeout; }
        public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }
    }

    /**
     * Graph model readiness polling.
     */
    public static class IndexingProperties {
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration timeout = Duration.ofMinutes(10);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class ProgressProperties {
        /**
         * Events replayed to subscribers that attach after a run started.
         */
        private int bufferSize = 64;

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
    }

    public static class ResumeProperties {
        /**
         * Re-check completed steps with {@code exists} before skipping them on resume.
         */
        private boolean verifyCompleted = true;

        public boolean isVerifyCompleted() { return verifyCompleted; }
        public void setVerifyCompleted(boolean verifyCompleted) { this.verifyCompleted = verifyCompleted; }
    }

    /**
     * Defaults applied to every step of the standard graph.
     */
    public static class StepProperties {
        private int retry = 2;
        private Duration backoff = Duration.ofSeconds(2);

        public int getRetry() { return retry; }
        public void setRetry(int retry) { this.retry = retry; }

        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
    }

    public static class ConfigStoreProperties {
        private Duration cacheTtl = Duration.ofSeconds(30);
        /**
         * {@code KEY=value} file backing the shared configuration. Kept in memory when unset.
         */
        private String envFile;

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }

        public String getEnvFile() { return envFile; }
        public void setEnvFile(String envFile) { this.envFile = envFile; }
    }

    public static class HealthProperties {
        private Duration cacheTtl = Duration.ofSeconds(30);

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    }

    /**
     * Cosmos DB NoSQL backend. Registered only when an endpoint is set.
     */
    public static class CosmosProperties {
        private String endpoint;
        private String key;
        private String database = "telemetry";
        private int maxItems = 1000;

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getDatabase() { return database; }
        public void setDatabase(String database) { this.database = database; }

        public int getMaxItems() { return maxItems; }
        public void setMaxItems(int maxItems) { this.maxItems = maxItems; }
    }

    /**
     * Retry policy of the graph query backend for throttling and cold starts.
     */
    public static class QueryProperties {
        private int maxRetries = 5;
        private Duration backoff = Duration.ofSeconds(2);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
    }

    public static class AdapterLoggingProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ScenarioProperties {
        /**
         * Data sources keyed by category ({@code graph}, {@code telemetry}).
         */
        private Map<String, DataSourceProperties> dataSources = new LinkedHashMap<>();

        public Map<String, DataSourceProperties> getDataSources() { return dataSources; }
        public void setDataSources(Map<String, DataSourceProperties> dataSources) { this.dataSources = dataSources; }
    }

    public static class DataSourceProperties {
        private String connector;
        private Map<String, String> params = new LinkedHashMap<>();

        public String getConnector() { return connector; }
        public void setConnector(String connector) { this.connector = connector; }

        public Map<String, String> getParams() { return params; }
        public void setParams(Map<String, String> params) { this.params = params; }
    }
}
