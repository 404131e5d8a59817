package com.firefly.provisioningengine.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable progress notification for one run.
 * <p>
 * {@code error}, {@code error_kind}, {@code retry_from} and {@code completed} are only present on a failed
 * terminal event. Percentages are clamped to [0,100].
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        @JsonProperty("run_id") String runId,
        @JsonProperty("step") String step,
        @JsonProperty("percent") int percent,
        @JsonProperty("label") String label,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error,
        @JsonProperty("error_kind") String errorKind,
        @JsonProperty("retry_from") String retryFrom,
        @JsonProperty("completed") List<String> completed) {

    public ProgressEvent {
        percent = Math.max(0, Math.min(100, percent));
        completed = completed == null ? null : List.copyOf(completed);
    }

    public static ProgressEvent progress(String runId, String step, int percent, String label) {
        return new ProgressEvent(runId, step, percent, label, RunStatus.RUNNING.wireName(), null, null, null, null);
    }

    public static ProgressEvent succeeded(String runId, String label, List<String> completed) {
        return new ProgressEvent(runId, null, 100, label, RunStatus.SUCCEEDED.wireName(), null, null, null, completed);
    }

    public static ProgressEvent failed(String runId, int percent, FailureReason reason, List<String> completed) {
        String label = reason.kind() == FailureKind.CANCELLED ? "Provisioning cancelled" : "Provisioning failed";
        return new ProgressEvent(runId, reason.stepId(), Math.min(percent, 99), label, RunStatus.FAILED.wireName(),
                reason.message(), reason.kind().wireName(), reason.stepId(), completed);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return !RunStatus.RUNNING.wireName().equals(status);
    }
}
