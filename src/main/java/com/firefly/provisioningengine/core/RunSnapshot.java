package com.firefly.provisioningengine.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only, point-in-time copy of a run's state. This is what progress consumers, status endpoints and
 * health checks see; they never get a reference to the live run state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunSnapshot {
    private final String runId;
    private final String scenarioId;
    private final RunStatus status;
    private final int percent;
    private final String label;
    private final String currentStep;
    private final List<String> selected;
    private final List<String> completed;
    private final Map<String, Map<String, String>> discovered;
    private final Map<String, StepStatus> steps;
    private final FailureReason failure;
    private final String resumedFrom;
    private final Instant startedAt;
    private final Instant finishedAt;

    public RunSnapshot(String runId,
                       String scenarioId,
                       RunStatus status,
                       int percent,
                       String label,
                       String currentStep,
                       List<String> selected,
                       List<String> completed,
                       Map<String, Map<String, String>> discovered,
                       Map<String, StepStatus> steps,
                       FailureReason failure,
                       String resumedFrom,
                       Instant startedAt,
                       Instant finishedAt) {
        this.runId = runId;
        this.scenarioId = scenarioId;
        this.status = status;
        this.percent = percent;
        this.label = label;
        this.currentStep = currentStep;
        this.selected = List.copyOf(selected);
        this.completed = List.copyOf(completed);
        Map<String, Map<String, String>> d = new LinkedHashMap<>();
        discovered.forEach((k, v) -> d.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        this.discovered = Collections.unmodifiableMap(d);
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        this.failure = failure;
        this.resumedFrom = resumedFrom;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    @JsonProperty("run_id")
    public String runId() { return runId; }

    @JsonProperty("scenario_id")
    public String scenarioId() { return scenarioId; }

    @JsonProperty("status")
    public RunStatus status() { return status; }

    @JsonProperty("percent")
    public int percent() { return percent; }

    @JsonProperty("label")
    public String label() { return label; }

    @JsonProperty("current_step")
    public String currentStep() { return currentStep; }

    @JsonProperty("selected")
    public List<String> selected() { return selected; }

    @JsonProperty("completed")
    public List<String> completed() { return completed; }

    @JsonProperty("discovered")
    public Map<String, Map<String, String>> discovered() { return discovered; }

    @JsonProperty("steps")
    public Map<String, StepStatus> steps() { return steps; }

    @JsonProperty("failure")
    public FailureReason failure() { return failure; }

    @JsonProperty("resumed_from")
    public String resumedFrom() { return resumedFrom; }

    @JsonProperty("started_at")
    public Instant startedAt() { return startedAt; }

    @JsonProperty("finished_at")
    public Instant finishedAt() { return finishedAt; }

    /** All discovered identifiers flattened into one map; later steps win on key clashes. */
    @JsonIgnore
    public Map<String, String> discoveredValues() {
        Map<String, String> flat = new LinkedHashMap<>();
        for (String stepId : completed) {
            Map<String, String> values = discovered.get(stepId);
            if (values != null) flat.putAll(values);
        }
        return flat;
    }

    /**
     * Progress event a reconnecting consumer should see first: the current status re-derived from this snapshot.
     */
    public ProgressEvent toProgressEvent() {
        return switch (status) {
            case RUNNING -> ProgressEvent.progress(runId, currentStep, percent, label);
            case SUCCEEDED -> ProgressEvent.succeeded(runId, label, completed);
            case FAILED -> ProgressEvent.failed(runId, percent,
                    failure != null ? failure : FailureReason.permanent(currentStep, "failed"), completed);
        };
    }

    @Override
    public String toString() {
        return "RunSnapshot{runId=" + runId + ", scenarioId=" + scenarioId + ", status=" + status
                + ", percent=" + percent + ", completed=" + completed + "}";
    }
}
