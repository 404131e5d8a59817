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

import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.ProgressEvent;
import com.firefly.provisioningengine.core.RunSnapshot;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.events.ProgressChannel;
import com.firefly.provisioningengine.observability.ProvisioningEvents;
import com.firefly.provisioningengine.registry.StepDefinition;
import com.firefly.provisioningengine.registry.StepGraph;
import com.firefly.provisioningengine.scenario.ScenarioCatalog;
import com.firefly.provisioningengine.scenario.ScenarioIds;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Entry point for provisioning: starts runs, reports their status and lets consumers reconnect or cancel.
 * <p>
 * A run is driven by its own subscription on {@code scheduler}, independent of whoever consumes its progress,
 * so a consumer that disconnects never cancels the run.
 */
public class ProvisioningEngine {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningEngine.class);

    private final StepGraph graph;
    private final ScenarioCatalog scenarios;
    private final ConfigurationAccessor configuration;
    private final RunRegistry runs;
    private final ResumeController resumes;
    private final OrchestratorExecutor executor;
    private final ProvisioningEvents events;
    private final Scheduler scheduler;
    private final int progressBufferSize;

    public ProvisioningEngine(StepGraph graph,
                              ScenarioCatalog scenarios,
                              ConfigurationAccessor configuration,
                              RunRegistry runs,
                              ResumeController resumes,
                              OrchestratorExecutor executor,
                              ProvisioningEvents events,
                              Scheduler scheduler,
                              int progressBufferSize) {
        this.graph = graph;
        this.scenarios = scenarios;
        this.configuration = configuration;
        this.runs = runs;
        this.resumes = resumes;
        this.executor = executor;
        this.events = events;
        this.scheduler = scheduler;
        this.progressBufferSize = progressBufferSize;
    }

    /**
     * Starts a run and streams its progress. Fails with {@code RunInProgressException} when the scenario already
     * has a running run, and with {@code ValidationException} for unknown scenarios or an invalid retry marker.
     */
    public Flux<ProgressEvent> provision(ProvisioningRequest request) {
        return start(request).flatMapMany(Function.identity());
    }

    /**
     * Like {@link #provision} but registers and launches the run before anything is streamed, so request errors
     * surface on the returned {@code Mono} itself.
     */
    public Mono<Flux<ProgressEvent>> start(ProvisioningRequest request) {
        return Mono.fromCallable(() -> ScenarioIds.requireValid(request.scenarioId()))
                .flatMap(scenarios::resolve)
                .zipWith(configuration.current())
                .map(t -> {
                    ScenarioConfig config = t.getT1();
                    List<StepDefinition> selection = graph.select(config);
                    Map<String, String> baseValues = new LinkedHashMap<>(t.getT2().values());
                    baseValues.putAll(request.configValues());
                    String runId = UUID.randomUUID().toString();
                    ActiveRun run = runs.begin(config.scenarioId(), latest -> new ActiveRun(
                            resumes.plan(runId, request, config, selection, baseValues, latest),
                            new ProgressChannel(runId, progressBufferSize)));
                    log.info(JsonUtils.json(
                            "provisioning_run", "accepted",
                            "scenario", config.scenarioId(),
                            "runId", runId,
                            "retryFrom", request.retryFrom(),
                            "resumedFrom", run.state().resumedFrom()
                    ));
                    launch(run);
                    return run.channel().stream();
                });
    }

    /** Latest run for the scenario, running or finished. */
    public Optional<RunSnapshot> status(String scenarioId) {
        return runs.latest(scenarioId).map(RunState::snapshot);
    }

    /**
     * Progress stream for a consumer reconnecting mid-run: the current status derived from the run snapshot,
     * then live events. For a finished run this is just its terminal event.
     */
    public Flux<ProgressEvent> reconnect(String scenarioId) {
        return Flux.defer(() -> {
            ActiveRun run = runs.find(scenarioId)
                    .orElseThrow(() -> new NoSuchElementException("No provisioning run for scenario '" + scenarioId + "'"));
            ProgressEvent current = run.state().snapshot().toProgressEvent();
            if (current.isTerminal()) {
                return Flux.just(current);
            }
            return run.channel().resume(current);
        });
    }

    /**
     * Requests cancellation of the scenario's running run. Honoured at the next step boundary.
     *
     * @return false if nothing is running for the scenario
     */
    public boolean cancel(String scenarioId) {
        return runs.running(scenarioId)
                .filter(run -> run.state().requestCancel())
                .map(run -> {
                    events.onCancelRequested(scenarioId, run.state().runId());
                    return true;
                })
                .orElse(false);
    }

    /** Disposes every running run; each is marked failed with a cancelled reason. */
    public void shutdown() {
        for (ActiveRun run : runs.all()) {
            if (run.state().isRunning()) {
                run.dispose();
            }
        }
    }

    private void launch(ActiveRun run) {
        RunState state = run.state();
        run.attach(executor.execute(graph, state, run.channel())
                .subscribeOn(scheduler)
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL && state.isRunning()) {
                        FailureReason reason = FailureReason.cancelled(state.currentStep());
                        state.fail(reason);
                        run.channel().emit(ProgressEvent.failed(state.runId(), state.percent(), reason, state.completed()));
                    }
                    run.channel().complete();
                })
                .subscribe(
                        snapshot -> log.info(JsonUtils.json(
                                "provisioning_run", "finished",
                                "scenario", snapshot.scenarioId(),
                                "runId", snapshot.runId(),
                                "status", snapshot.status().wireName(),
                                "completed", String.join(",", snapshot.completed())
                        )),
                        err -> log.error(JsonUtils.json(
                                "provisioning_run", "execution_error",
                                "scenario", state.scenarioId(),
                                "runId", state.runId(),
                                "error_msg", JsonUtils.errorMessage(err, 500)
                        ), err)));
    }
}
