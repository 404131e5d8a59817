package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.core.FailureReason;

import java.util.Objects;

/**
 * Outcome of one guarded step execution. {@link Outcome#CREATED} and {@link Outcome#ALREADY_EXISTS} are both
 * success; {@link Outcome#FAILED} always carries a classified {@link FailureReason}.
 */
public final class StepResult {

    public enum Outcome { CREATED, ALREADY_EXISTS, FAILED }

    private final Outcome outcome;
    private final DiscoveredResource resource;
    private final FailureReason failure;
    private final int attempts;

    private StepResult(Outcome outcome, DiscoveredResource resource, FailureReason failure, int attempts) {
        this.outcome = outcome;
        this.resource = resource;
        this.failure = failure;
        this.attempts = attempts;
    }

    public static StepResult created(DiscoveredResource resource, int attempts) {
        return new StepResult(Outcome.CREATED, nonNull(resource), null, attempts);
    }

    public static StepResult alreadyExists(DiscoveredResource resource, int attempts) {
        return new StepResult(Outcome.ALREADY_EXISTS, nonNull(resource), null, attempts);
    }

    public static StepResult failed(FailureReason reason, int attempts) {
        return new StepResult(Outcome.FAILED, DiscoveredResource.none(), Objects.requireNonNull(reason, "reason"), attempts);
    }

    private static DiscoveredResource nonNull(DiscoveredResource resource) {
        return resource != null ? resource : DiscoveredResource.none();
    }

    public Outcome outcome() { return outcome; }

    public DiscoveredResource resource() { return resource; }

    public FailureReason failure() { return failure; }

    public int attempts() { return attempts; }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    @Override
    public String toString() {
        return outcome == Outcome.FAILED
                ? "Failed(" + failure.kind() + ": " + failure.message() + ")"
                : (outcome == Outcome.CREATED ? "Created(" : "AlreadyExists(") + resource.primaryId() + ")";
    }
}
