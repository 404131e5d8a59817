package com.firefly.provisioningengine.core;

/**
 * Per-step status as seen in a {@link RunSnapshot}.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    /** Resource was created by this run. */
    CREATED,
    /** Resource already existed; nothing was created. */
    EXISTING,
    /** Completed by an earlier run and re-verified on resume. */
    VERIFIED,
    FAILED
}
