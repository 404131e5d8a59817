package com.firefly.provisioningengine.core;

import java.util.Objects;

/**
 * Classified reason for a failed step: which step, what kind of failure and a message
 * fit for showing to an operator.
 */
public record FailureReason(String stepId, FailureKind kind, String message) {

    public FailureReason {
        Objects.requireNonNull(kind, "kind");
        message = message == null || message.isBlank() ? kind.wireName() : message;
    }

    public static FailureReason transientFailure(String stepId, String message) {
        return new FailureReason(stepId, FailureKind.TRANSIENT, message);
    }

    public static FailureReason permanent(String stepId, String message) {
        return new FailureReason(stepId, FailureKind.PERMANENT, message);
    }

    public static FailureReason cancelled(String stepId) {
        return new FailureReason(stepId, FailureKind.CANCELLED, "cancelled");
    }
}
