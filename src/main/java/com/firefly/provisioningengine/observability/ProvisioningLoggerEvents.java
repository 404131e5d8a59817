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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.firefly.provisioningengine.util.JsonUtils.json;
import static com.firefly.provisioningengine.util.JsonUtils.safeString;

/**
 * Default {@link ProvisioningEvents} implementation emitting single-line JSON logs via SLF4J.
 */
public class ProvisioningLoggerEvents implements ProvisioningEvents {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningLoggerEvents.class);

    @Override
    public void onRunStarted(String scenarioId, String runId, List<String> selected, String resumedFrom) {
        log.info(json(
                "provisioning_event", "run_started",
                "scenario", scenarioId,
                "runId", runId,
                "steps", String.join(",", selected),
                "resumedFrom", resumedFrom
        ));
    }

    @Override
    public void onStepStarted(String scenarioId, String runId, String stepId) {
        log.info(json(
                "provisioning_event", "step_started",
                "scenario", scenarioId,
                "runId", runId,
                "stepId", stepId
        ));
    }

    @Override
    public void onStepSucceeded(String scenarioId, String runId, String stepId, StepResult.Outcome outcome, int attempts, long latencyMs) {
        log.info(json(
                "provisioning_event", "step_success",
                "scenario", scenarioId,
                "runId", runId,
                "stepId", stepId,
                "outcome", outcome.name().toLowerCase(),
                "attempts", Integer.toString(attempts),
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onStepVerified(String scenarioId, String runId, String stepId, boolean present) {
        if (present) {
            log.info(json(
                    "provisioning_event", "step_verified",
                    "scenario", scenarioId,
                    "runId", runId,
                    "stepId", stepId
            ));
        } else {
            log.warn(json(
                    "provisioning_event", "step_stale",
                    "scenario", scenarioId,
                    "runId", runId,
                    "stepId", stepId,
                    "reason", "resource recorded as completed no longer exists; re-executing"
            ));
        }
    }

    @Override
    public void onStepFailed(String scenarioId, String runId, String stepId, FailureReason reason, int attempts, long latencyMs) {
        log.warn(json(
                "provisioning_event", "step_failed",
                "scenario", scenarioId,
                "runId", runId,
                "stepId", stepId,
                "kind", reason.kind().wireName(),
                "attempts", Integer.toString(attempts),
                "latencyMs", Long.toString(latencyMs),
                "error_msg", safeString(reason.message(), 500)
        ));
    }

    @Override
    public void onCancelRequested(String scenarioId, String runId) {
        log.info(json(
                "provisioning_event", "cancel_requested",
                "scenario", scenarioId,
                "runId", runId
        ));
    }

    @Override
    public void onRunCompleted(String scenarioId, String runId, RunStatus status, long durationMs) {
        log.info(json(
                "provisioning_event", "run_completed",
                "scenario", scenarioId,
                "runId", runId,
                "status", status.wireName(),
                "durationMs", Long.toString(durationMs)
        ));
    }
}
