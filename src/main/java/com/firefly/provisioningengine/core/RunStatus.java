package com.firefly.provisioningengine.core;

import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal status of a provisioning run. */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
