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

package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.adapter.ConfigurationPublishAdapter;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceAdapterRegistry;
import com.firefly.provisioningengine.adapter.inmemory.InMemoryAdapters;
import com.firefly.provisioningengine.adapter.inmemory.InMemoryResourcePlatform;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.InMemoryConfigurationStore;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.FailureKind;
import com.firefly.provisioningengine.core.ProgressEvent;
import com.firefly.provisioningengine.core.RunSnapshot;
import com.firefly.provisioningengine.core.RunStatus;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.core.StepStatus;
import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import com.firefly.provisioningengine.exceptions.RunInProgressException;
import com.firefly.provisioningengine.exceptions.ValidationException;
import com.firefly.provisioningengine.observability.ProvisioningEvents;
import com.firefly.provisioningengine.registry.ProgressBand;
import com.firefly.provisioningengine.registry.StandardStepGraph;
import com.firefly.provisioningengine.registry.StepGraph;
import com.firefly.provisioningengine.registry.StepGraphBuilder;
import com.firefly.provisioningengine.scenario.MapScenarioCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ProvisioningEngineTest {

    private static final String SCENARIO = "telco-noc";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private InMemoryResourcePlatform platform;
    private ConfigurationAccessor accessor;
    private MapScenarioCatalog catalog;
    private final ProvisioningEvents events = new ProvisioningEvents() {};

    @BeforeEach
    void setUp() {
        platform = new InMemoryResourcePlatform();
        accessor = new ConfigurationAccessor(new InMemoryConfigurationStore(), Map.of(), Duration.ofMinutes(1));
        catalog = new MapScenarioCatalog(Map.of(SCENARIO, ScenarioConfig.builder(SCENARIO)
                .dataSource(ScenarioConfig.GRAPH, Connectors.FABRIC_GQL)
                .dataSource(ScenarioConfig.TELEMETRY, Connectors.FABRIC_KQL)
                .build()));
    }

    private ProvisioningEngine engine(StepGraph graph, List<ResourceAdapter> adapters) {
        ErrorClassifier classifier = new ErrorClassifier();
        OrchestratorExecutor executor = new OrchestratorExecutor(new ResourceAdapterRegistry(adapters),
                new IdempotencyGuard(classifier), classifier, new TargetResolver(new ResourceNaming("noc-ws", null)),
                events, true);
        return new ProvisioningEngine(graph, catalog, accessor, new RunRegistry(), new ResumeController(),
                executor, events, Schedulers.immediate(), 64);
    }

    private ProvisioningEngine standardEngine() {
        List<ResourceAdapter> adapters = new ArrayList<>(InMemoryAdapters.standard(platform));
        adapters.add(new ConfigurationPublishAdapter(accessor));
        return engine(StandardStepGraph.create(), adapters);
    }

    private static List<ProgressEvent> collect(Flux<ProgressEvent> events) {
        List<ProgressEvent> list = events.collectList().block(WAIT);
        assertNotNull(list);
        return list;
    }

    @Test
    void fullRunStreamsMonotonicProgressAndPublishesConfiguration() {
        ProvisioningEngine engine = standardEngine();

        List<ProgressEvent> events = collect(engine.provision(ProvisioningRequest.of(SCENARIO)));

        assertEquals("Starting provisioning...", events.get(0).label());
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).percent() >= events.get(i - 1).percent(), "percent went backwards at " + i);
        }
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals("succeeded", last.status());
        assertEquals(100, last.percent());
        assertEquals(OrchestratorExecutor.SUCCESS_LABEL, last.label());
        assertEquals(10, last.completed().size());

        RunSnapshot snapshot = engine.status(SCENARIO).orElseThrow();
        assertEquals(RunStatus.SUCCEEDED, snapshot.status());
        assertEquals(StepStatus.CREATED, snapshot.steps().get(StandardStepGraph.STORAGE));
        assertEquals("noc-ws", snapshot.discoveredValues().get(ConfigKeys.WORKSPACE_NAME));

        String graphModelId = snapshot.discoveredValues().get(ConfigKeys.GRAPH_MODEL_ID);
        assertNotNull(graphModelId);
        assertEquals(graphModelId, accessor.current().block(WAIT).graphModelId().orElseThrow());
    }

    @Test
    void rerunningACompletedScenarioCreatesNothing() {
        ProvisioningEngine engine = standardEngine();
        collect(engine.provision(ProvisioningRequest.of(SCENARIO)));
        int created = platform.createLog().size();

        List<ProgressEvent> events = collect(engine.provision(ProvisioningRequest.of(SCENARIO)));

        assertEquals("succeeded", events.get(events.size() - 1).status());
        assertEquals(created, platform.createLog().size());
        assertEquals(StepStatus.EXISTING, engine.status(SCENARIO).orElseThrow().steps().get(StandardStepGraph.STORAGE));
    }

    @Test
    void failedRunResumesFromTheFailedStepWithoutRecreatingEarlierResources() {
        ProvisioningEngine engine = standardEngine();
        platform.failNext("ontology", new PermanentAdapterException("Ontology definition rejected"));

        List<ProgressEvent> failedRun = collect(engine.provision(ProvisioningRequest.of(SCENARIO)));

        ProgressEvent failure = failedRun.get(failedRun.size() - 1);
        assertEquals("failed", failure.status());
        assertEquals(StandardStepGraph.ONTOLOGY_BUILD, failure.retryFrom());
        assertEquals("permanent", failure.errorKind());
        assertEquals("Ontology definition rejected", failure.error());
        assertTrue(failure.percent() < 100);
        assertTrue(failure.completed().contains(StandardStepGraph.TABLES));
        String failedRunId = failure.runId();

        List<ProgressEvent> resumed = collect(engine.provision(
                new ProvisioningRequest(SCENARIO, Map.of(), StandardStepGraph.ONTOLOGY_BUILD)));

        assertEquals("succeeded", resumed.get(resumed.size() - 1).status());
        assertEquals(1, platform.createCount("lakehouse"));
        assertEquals(2, platform.createCount("ontology"));
        RunSnapshot snapshot = engine.status(SCENARIO).orElseThrow();
        assertEquals(failedRunId, snapshot.resumedFrom());
        assertEquals(StepStatus.VERIFIED, snapshot.steps().get(StandardStepGraph.STORAGE));
        assertEquals(StepStatus.CREATED, snapshot.steps().get(StandardStepGraph.ONTOLOGY_BUILD));
    }

    @Test
    void resumeRecreatesAResourceThatVanished() {
        ProvisioningEngine engine = standardEngine();
        platform.failNext("ontology", new PermanentAdapterException("boom"));
        collect(engine.provision(ProvisioningRequest.of(SCENARIO)));
        RunSnapshot failed = engine.status(SCENARIO).orElseThrow();
        String workspaceId = failed.discoveredValues().get(ConfigKeys.WORKSPACE_ID);
        String oldLakehouseId = failed.discoveredValues().get(ConfigKeys.LAKEHOUSE_ID);
        assertTrue(platform.delete("lakehouse", workspaceId, "telco-noc-lakehouse"));

        List<ProgressEvent> resumed = collect(engine.provision(
                new ProvisioningRequest(SCENARIO, Map.of(), StandardStepGraph.ONTOLOGY_BUILD)));

        assertEquals("succeeded", resumed.get(resumed.size() - 1).status());
        assertEquals(2, platform.createCount("lakehouse"));
        RunSnapshot snapshot = engine.status(SCENARIO).orElseThrow();
        assertEquals(StepStatus.CREATED, snapshot.steps().get(StandardStepGraph.STORAGE));
        assertNotEquals(oldLakehouseId, snapshot.discoveredValues().get(ConfigKeys.LAKEHOUSE_ID));
    }

    @Test
    void retryFromAStepOtherThanTheFailedOneIsRejected() {
        ProvisioningEngine engine = standardEngine();
        platform.failNext("ontology", new PermanentAdapterException("boom"));
        collect(engine.provision(ProvisioningRequest.of(SCENARIO)));

        StepVerifier.create(engine.provision(new ProvisioningRequest(SCENARIO, Map.of(), StandardStepGraph.UPLOAD)))
                .expectError(ValidationException.class)
                .verify(WAIT);
    }

    @Test
    void retryWithoutAPriorFailureStartsFresh() {
        ProvisioningEngine engine = standardEngine();

        List<ProgressEvent> events = collect(engine.provision(
                new ProvisioningRequest(SCENARIO, Map.of(), StandardStepGraph.ONTOLOGY_BUILD)));

        assertEquals("succeeded", events.get(events.size() - 1).status());
        assertNull(engine.status(SCENARIO).orElseThrow().resumedFrom());
    }

    @Test
    void unknownScenarioIsRejected() {
        StepVerifier.create(standardEngine().provision(ProvisioningRequest.of("unknown")))
                .expectError(ValidationException.class)
                .verify(WAIT);
    }

    @Test
    void nameOverridesAreApplied() {
        ProvisioningEngine engine = standardEngine();

        collect(engine.provision(new ProvisioningRequest(SCENARIO, Map.of("lakehouse_name", "custom-lh"), null)));

        assertTrue(platform.createLog().contains("lakehouse:custom-lh"));
        assertEquals("custom-lh", engine.status(SCENARIO).orElseThrow().discoveredValues().get(ConfigKeys.LAKEHOUSE_NAME));
    }

    private static StepGraph gatedGraph() {
        return StepGraphBuilder.graph("gated")
                .step("first").band(ProgressBand.WORKSPACE).label("First...").doneLabel("First done").add()
                .step("second").dependsOn("first").band(ProgressBand.FINALIZE)
                    .label("Second...").doneLabel("Second done").add()
                .build();
    }

    @Test
    void concurrentRunIsRejectedAndCancelStopsAtTheNextStepBoundary() {
        Sinks.One<DiscoveredResource> gate = Sinks.one();
        ScriptedAdapter first = new ScriptedAdapter("first").createReturns(gate.asMono());
        ScriptedAdapter second = new ScriptedAdapter("second");
        ProvisioningEngine engine = engine(gatedGraph(), List.of(first, second));

        Flux<ProgressEvent> stream = engine.start(ProvisioningRequest.of(SCENARIO)).block(WAIT);
        assertNotNull(stream);
        String runId = engine.status(SCENARIO).orElseThrow().runId();

        StepVerifier.create(engine.start(ProvisioningRequest.of(SCENARIO)))
                .expectErrorSatisfies(err -> {
                    assertInstanceOf(RunInProgressException.class, err);
                    assertEquals(runId, ((RunInProgressException) err).getRunId());
                })
                .verify(WAIT);

        assertTrue(engine.cancel(SCENARIO));
        assertFalse(engine.cancel(SCENARIO));
        gate.tryEmitValue(DiscoveredResource.of("FIRST_ID", "f-1"));

        List<ProgressEvent> events = collect(stream);
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals("failed", last.status());
        assertEquals("cancelled", last.errorKind());
        assertEquals("second", last.retryFrom());
        assertEquals("Provisioning cancelled", last.label());
        assertEquals(List.of("first"), last.completed());
        assertEquals(0, second.createCalls.get());
    }

    @Test
    void reconnectStartsFromTheCurrentSnapshot() {
        Sinks.One<DiscoveredResource> gate = Sinks.one();
        ScriptedAdapter first = new ScriptedAdapter("first").createReturns(gate.asMono());
        ProvisioningEngine engine = engine(gatedGraph(), List.of(first, new ScriptedAdapter("second")));
        engine.start(ProvisioningRequest.of(SCENARIO)).block(WAIT);

        StepVerifier.create(engine.reconnect(SCENARIO))
                .assertNext(current -> {
                    assertEquals("first", current.step());
                    assertEquals("running", current.status());
                    assertEquals("First...", current.label());
                })
                .then(() -> gate.tryEmitValue(DiscoveredResource.of("FIRST_ID", "f-1")))
                .assertNext(e -> assertEquals("First done", e.label()))
                .assertNext(e -> assertEquals("Second...", e.label()))
                .assertNext(e -> assertEquals("Second done", e.label()))
                .assertNext(e -> assertEquals("succeeded", e.status()))
                .verifyComplete();

        StepVerifier.create(engine.reconnect(SCENARIO))
                .assertNext(e -> assertEquals("succeeded", e.status()))
                .verifyComplete();
    }

    @Test
    void reconnectWithoutAnyRunFails() {
        StepVerifier.create(standardEngine().reconnect(SCENARIO))
                .expectError(NoSuchElementException.class)
                .verify(WAIT);
    }

    @Test
    void shutdownMarksRunningRunsCancelled() {
        Sinks.One<DiscoveredResource> gate = Sinks.one();
        ProvisioningEngine engine = engine(gatedGraph(),
                List.of(new ScriptedAdapter("first").createReturns(gate.asMono()), new ScriptedAdapter("second")));
        Flux<ProgressEvent> stream = engine.start(ProvisioningRequest.of(SCENARIO)).block(WAIT);
        assertNotNull(stream);

        engine.shutdown();

        RunSnapshot snapshot = engine.status(SCENARIO).orElseThrow();
        assertEquals(RunStatus.FAILED, snapshot.status());
        assertEquals(FailureKind.CANCELLED, snapshot.failure().kind());
        assertEquals("first", snapshot.failure().stepId());
        List<ProgressEvent> events = collect(stream);
        assertEquals("cancelled", events.get(events.size() - 1).errorKind());
    }
}
