package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceAdapterRegistry;
import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.ProgressEvent;
import com.firefly.provisioningengine.core.RunSnapshot;
import com.firefly.provisioningengine.core.StepStatus;
import com.firefly.provisioningengine.events.ProgressChannel;
import com.firefly.provisioningengine.observability.ProvisioningEvents;
import com.firefly.provisioningengine.registry.StepDefinition;
import com.firefly.provisioningengine.registry.StepGraph;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a run's selected steps strictly in order.
 * <p>
 * For each step it:
 * - stops with a {@code cancelled} failure if cancellation was requested (only ever observed between steps);
 * - re-verifies steps a resumed run already completed, executing them again only if their resource vanished;
 * - checks that every dependency has completed (a violation is a permanent failure);
 * - runs the step through the {@link IdempotencyGuard} and records discovered identifiers;
 * - emits a start event at the step's band start and a done event at its band end.
 * The first failed step ends the run; remaining steps are not attempted. The run's progress channel receives a
 * terminal event either way. The channel itself is completed by the caller.
 */
public class OrchestratorExecutor {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorExecutor.class);

    public static final String SUCCESS_LABEL = "Provisioning complete";

    private final ResourceAdapterRegistry adapters;
    private final IdempotencyGuard guard;
    private final ErrorClassifier classifier;
    private final TargetResolver targets;
    private final ProvisioningEvents events;
    private final boolean verifyCompleted;

    public OrchestratorExecutor(ResourceAdapterRegistry adapters,
                                IdempotencyGuard guard,
                                ErrorClassifier classifier,
                                TargetResolver targets,
                                ProvisioningEvents events,
                                boolean verifyCompleted) {
        this.adapters = adapters;
        this.guard = guard;
        this.classifier = classifier;
        this.targets = targets;
        this.events = events;
        this.verifyCompleted = verifyCompleted;
    }

    public Mono<RunSnapshot> execute(StepGraph graph, RunState state, ProgressChannel channel) {
        return Mono.defer(() -> {
            long started = System.currentTimeMillis();
            List<StepDefinition> steps = state.selected().stream().map(graph::step).toList();
            events.onRunStarted(state.scenarioId(), state.runId(), state.selected(), state.resumedFrom());
            if (log.isDebugEnabled()) {
                log.debug(JsonUtils.json(
                        "provisioning_topology", "selected",
                        "scenario", state.scenarioId(),
                        "runId", state.runId(),
                        "steps", String.join(",", state.selected()),
                        "completed", String.join(",", state.completed())
                ));
            }
            channel.emit(ProgressEvent.progress(state.runId(), null, state.percent(), "Starting provisioning..."));
            return Flux.fromIterable(steps)
                    .concatMap(step -> runStep(state, step, channel))
                    .takeWhile(Boolean::booleanValue)
                    .then(Mono.fromCallable(() -> finish(state, channel, started)))
                    .onErrorResume(err -> Mono.fromCallable(() -> abort(state, channel, err, started)));
        });
    }

    private Mono<Boolean> runStep(RunState state, StepDefinition step, ProgressChannel channel) {
        return Mono.defer(() -> {
            if (state.isCancelRequested()) {
                log.info(JsonUtils.json(
                        "provisioning_step", "cancelled",
                        "scenario", state.scenarioId(),
                        "runId", state.runId(),
                        "stepId", step.id
                ));
                failRun(state, channel, FailureReason.cancelled(step.id));
                return Mono.just(false);
            }
            if (state.isCompleted(step.id)) {
                return verifyCompleted(state, step, channel);
            }
            return executeStep(state, step, channel);
        });
    }

    private Mono<Boolean> verifyCompleted(RunState state, StepDefinition step, ProgressChannel channel) {
        if (!verifyCompleted) {
            markVerified(state, step, channel, Map.of());
            return Mono.just(true);
        }
        return Mono.fromCallable(() -> adapters.resolve(step.adapter))
                .flatMap(adapter -> guard.verify(step, adapter, targets.resolve(state, step)))
                .onErrorResume(err -> {
                    log.warn(JsonUtils.json(
                            "provisioning_step", "verify_error",
                            "scenario", state.scenarioId(),
                            "runId", state.runId(),
                            "stepId", step.id,
                            "error_class", err.getClass().getName(),
                            "error_msg", JsonUtils.errorMessage(err, 300)
                    ));
                    return Mono.just(Optional.empty());
                })
                .flatMap(found -> {
                    events.onStepVerified(state.scenarioId(), state.runId(), step.id, found.isPresent());
                    if (found.isPresent()) {
                        markVerified(state, step, channel, found.get().values());
                        return Mono.just(true);
                    }
                    state.revoke(step.id);
                    return executeStep(state, step, channel);
                });
    }

    private void markVerified(RunState state, StepDefinition step, ProgressChannel channel,
                              Map<String, String> values) {
        state.complete(step.id, StepStatus.VERIFIED, values, step.band.end(), step.doneLabel);
        channel.emit(ProgressEvent.progress(state.runId(), step.id, state.percent(), step.doneLabel));
    }

    private Mono<Boolean> executeStep(RunState state, StepDefinition step, ProgressChannel channel) {
        List<String> missing = step.dependsOn.stream().filter(d -> !state.isCompleted(d)).toList();
        if (!missing.isEmpty()) {
            log.error(JsonUtils.json(
                    "provisioning_step", "dependency_violation",
                    "scenario", state.scenarioId(),
                    "runId", state.runId(),
                    "stepId", step.id,
                    "missing", String.join(",", missing)
            ));
            failRun(state, channel, FailureReason.permanent(step.id,
                    "Dependencies not completed: " + String.join(", ", missing)));
            return Mono.just(false);
        }

        state.start(step.id, step.band.start(), step.label);
        events.onStepStarted(state.scenarioId(), state.runId(), step.id);
        channel.emit(ProgressEvent.progress(state.runId(), step.id, state.percent(), step.label));
        final long start = System.currentTimeMillis();

        return Mono.fromCallable(() -> adapters.resolve(step.adapter))
                .flatMap((ResourceAdapter adapter) -> guard.execute(step, adapter, targets.resolve(state, step)))
                .onErrorResume(err -> Mono.just(StepResult.failed(classifier.toReason(step.id, err), 0)))
                .map(result -> {
                    long latency = System.currentTimeMillis() - start;
                    if (result.isSuccess()) {
                        StepStatus status = result.outcome() == StepResult.Outcome.CREATED
                                ? StepStatus.CREATED : StepStatus.EXISTING;
                        state.complete(step.id, status, result.resource().values(), step.band.end(), step.doneLabel);
                        if (log.isInfoEnabled()) {
                            log.info(JsonUtils.json(
                                    "provisioning_step", result.outcome() == StepResult.Outcome.CREATED ? "created" : "already_exists",
                                    "scenario", state.scenarioId(),
                                    "runId", state.runId(),
                                    "stepId", step.id,
                                    "attempts", Integer.toString(result.attempts()),
                                    "latencyMs", Long.toString(latency),
                                    "discovered", String.join(",", result.resource().values().keySet())
                            ));
                        }
                        events.onStepSucceeded(state.scenarioId(), state.runId(), step.id, result.outcome(),
                                result.attempts(), latency);
                        channel.emit(ProgressEvent.progress(state.runId(), step.id, state.percent(), step.doneLabel));
                        return true;
                    }
                    FailureReason reason = result.failure();
                    log.warn(JsonUtils.json(
                            "provisioning_step", "error",
                            "scenario", state.scenarioId(),
                            "runId", state.runId(),
                            "stepId", step.id,
                            "attempts", Integer.toString(result.attempts()),
                            "latencyMs", Long.toString(latency),
                            "error_kind", reason.kind().wireName(),
                            "error_msg", reason.message()
                    ));
                    events.onStepFailed(state.scenarioId(), state.runId(), step.id, reason, result.attempts(), latency);
                    failRun(state, channel, reason);
                    return false;
                });
    }

    private void failRun(RunState state, ProgressChannel channel, FailureReason reason) {
        state.fail(reason);
        channel.emit(ProgressEvent.failed(state.runId(), state.percent(), reason, state.completed()));
    }

    private RunSnapshot finish(RunState state, ProgressChannel channel, long started) {
        if (state.isRunning()) {
            state.succeed(SUCCESS_LABEL);
            channel.emit(ProgressEvent.succeeded(state.runId(), SUCCESS_LABEL, state.completed()));
        }
        long duration = System.currentTimeMillis() - started;
        events.onRunCompleted(state.scenarioId(), state.runId(), state.status(), duration);
        return state.snapshot();
    }

    private RunSnapshot abort(RunState state, ProgressChannel channel, Throwable err, long started) {
        log.error(JsonUtils.json(
                "provisioning_run", "unexpected_error",
                "scenario", state.scenarioId(),
                "runId", state.runId(),
                "stepId", state.currentStep(),
                "error_class", err.getClass().getName(),
                "error_msg", JsonUtils.errorMessage(err, 500)
        ), err);
        if (state.isRunning()) {
            failRun(state, channel, FailureReason.permanent(state.currentStep(), JsonUtils.errorMessage(err, 500)));
        }
        return finish(state, channel, started);
    }
}
