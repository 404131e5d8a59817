package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.core.FailureKind;
import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.RunSnapshot;
import com.firefly.provisioningengine.core.RunStatus;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.core.StepStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable bookkeeping for one provisioning run (in-memory only).
 * <p>
 * Only the executor (and the resume controller while seeding) mutates a run, which is why the mutators are
 * package-private. Everyone else reads through {@link #snapshot()}.
 * <p>
 * Invariants: completed steps are a subset of the selected ones; discovered identifiers exist only for
 * completed steps; a succeeded or failed run never changes again.
 */
public final class RunState {
    private final String runId;
    private final ScenarioConfig config;
    private final List<String> selected;
    private final Map<String, String> baseValues;
    private final Map<String, String> overrides;
    private final String resumedFrom;
    private final Instant startedAt = Instant.now();

    private final Set<String> completed = new LinkedHashSet<>();
    private final Map<String, Map<String, String>> discovered = new LinkedHashMap<>();
    private final Map<String, StepStatus> stepStatuses = new LinkedHashMap<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private RunStatus status = RunStatus.RUNNING;
    private String currentStep;
    private int percent;
    private String label = "Starting provisioning...";
    private FailureReason failure;
    private Instant finishedAt;

    RunState(String runId,
             ScenarioConfig config,
             List<String> selected,
             Map<String, String> baseValues,
             Map<String, String> overrides,
             String resumedFrom) {
        this.runId = runId;
        this.config = config;
        this.selected = List.copyOf(selected);
        this.baseValues = baseValues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(baseValues));
        this.overrides = overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
        this.resumedFrom = resumedFrom;
        for (String id : this.selected) {
            stepStatuses.put(id, StepStatus.PENDING);
        }
    }

    public String runId() { return runId; }

    public String scenarioId() { return config.scenarioId(); }

    public ScenarioConfig config() { return config; }

    public List<String> selected() { return selected; }

    /** Shared configuration and mapped overrides captured when the run started. */
    public Map<String, String> baseValues() { return baseValues; }

    public Map<String, String> overrides() { return overrides; }

    public String resumedFrom() { return resumedFrom; }

    public Instant startedAt() { return startedAt; }

    public synchronized RunStatus status() { return status; }

    public synchronized boolean isRunning() { return status == RunStatus.RUNNING; }

    public synchronized int percent() { return percent; }

    public synchronized String currentStep() { return currentStep; }

    public synchronized boolean isCompleted(String stepId) { return completed.contains(stepId); }

    public synchronized List<String> completed() { return List.copyOf(completed); }

    public synchronized FailureReason failure() { return failure; }

    /** Discovered identifiers of all completed steps, flattened in completion order. */
    public synchronized Map<String, String> discoveredValues() {
        Map<String, String> flat = new LinkedHashMap<>();
        for (String id : completed) {
            Map<String, String> values = discovered.get(id);
            if (values != null) flat.putAll(values);
        }
        return flat;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /** @return true if this call flipped the flag on a running run */
    boolean requestCancel() {
        synchronized (this) {
            if (status != RunStatus.RUNNING) return false;
        }
        return cancelRequested.compareAndSet(false, true);
    }

    synchronized void seedCompleted(String stepId, Map<String, String> values) {
        requireRunning();
        requireSelected(stepId);
        completed.add(stepId);
        discovered.put(stepId, new LinkedHashMap<>(values == null ? Map.of() : values));
        stepStatuses.put(stepId, StepStatus.PENDING);
    }

    synchronized void start(String stepId, int atPercent, String startLabel) {
        requireRunning();
        requireSelected(stepId);
        currentStep = stepId;
        stepStatuses.put(stepId, StepStatus.RUNNING);
        advance(atPercent, startLabel);
    }

    synchronized void complete(String stepId, StepStatus stepStatus, Map<String, String> values,
                               int atPercent, String doneLabel) {
        requireRunning();
        requireSelected(stepId);
        completed.add(stepId);
        Map<String, String> merged = new LinkedHashMap<>(discovered.getOrDefault(stepId, Map.of()));
        if (values != null) merged.putAll(values);
        discovered.put(stepId, merged);
        stepStatuses.put(stepId, stepStatus);
        currentStep = stepId;
        advance(atPercent, doneLabel);
    }

    /** Drops a completed step whose resource could not be re-verified. */
    synchronized void revoke(String stepId) {
        requireRunning();
        completed.remove(stepId);
        discovered.remove(stepId);
        stepStatuses.put(stepId, StepStatus.PENDING);
    }

    synchronized void fail(FailureReason reason) {
        requireRunning();
        failure = reason;
        status = RunStatus.FAILED;
        if (reason.stepId() != null && stepStatuses.containsKey(reason.stepId())
                && !completed.contains(reason.stepId())) {
            stepStatuses.put(reason.stepId(), StepStatus.FAILED);
        }
        currentStep = reason.stepId();
        label = reason.kind() == FailureKind.CANCELLED
                ? "Provisioning cancelled" : "Provisioning failed";
        finishedAt = Instant.now();
    }

    synchronized void succeed(String finalLabel) {
        requireRunning();
        status = RunStatus.SUCCEEDED;
        currentStep = null;
        percent = 100;
        label = finalLabel;
        finishedAt = Instant.now();
    }

    public synchronized RunSnapshot snapshot() {
        return new RunSnapshot(runId, config.scenarioId(), status, percent, label, currentStep,
                selected, new ArrayList<>(completed), discovered, stepStatuses, failure, resumedFrom,
                startedAt, finishedAt);
    }

    private void advance(int atPercent, String newLabel) {
        percent = Math.max(percent, Math.min(100, atPercent));
        if (newLabel != null) label = newLabel;
    }

    private void requireRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is " + status.wireName() + " and can no longer change");
        }
    }

    private void requireSelected(String stepId) {
        if (!selected.contains(stepId)) {
            throw new IllegalStateException("Step '" + stepId + "' is not selected for run " + runId);
        }
    }
}
