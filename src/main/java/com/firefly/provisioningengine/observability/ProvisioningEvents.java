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

package com.firefly.provisioningengine.observability;

import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.RunStatus;
import com.firefly.provisioningengine.engine.StepResult;

import java.util.List;

/**
 * Observability hook for provisioning lifecycle events.
 * Implementations can log, publish metrics, or integrate with tracing systems.
 * All methods default to no-ops.
 */
public interface ProvisioningEvents {

    default void onRunStarted(String scenarioId, String runId, List<String> selected, String resumedFrom) {}

    default void onStepStarted(String scenarioId, String runId, String stepId) {}

    default void onStepSucceeded(String scenarioId, String runId, String stepId, StepResult.Outcome outcome,
                                 int attempts, long latencyMs) {}

    /** A step completed by an earlier run was re-checked on resume; {@code present} tells whether it still exists. */
    default void onStepVerified(String scenarioId, String runId, String stepId, boolean present) {}

    default void onStepFailed(String scenarioId, String runId, String stepId, FailureReason reason,
                              int attempts, long latencyMs) {}

    default void onCancelRequested(String scenarioId, String runId) {}

    default void onRunCompleted(String scenarioId, String runId, RunStatus status, long durationMs) {}
}
