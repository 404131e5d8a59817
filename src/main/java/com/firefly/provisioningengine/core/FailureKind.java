package com.firefly.provisioningengine.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification attached to every failed step. Only {@link #TRANSIENT} failures are retried automatically.
 */
public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
