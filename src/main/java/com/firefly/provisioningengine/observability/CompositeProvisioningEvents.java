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
import java.util.function.Consumer;

/**
 * Fans every event out to a list of sinks. A failing sink is logged and does not stop the others or the run.
 */
public class CompositeProvisioningEvents implements ProvisioningEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeProvisioningEvents.class);

    private final List<ProvisioningEvents> delegates;

    public CompositeProvisioningEvents(List<ProvisioningEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<ProvisioningEvents> delegates() {
        return delegates;
    }

    private void each(Consumer<ProvisioningEvents> call) {
        for (ProvisioningEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("Provisioning events sink {} failed: {}", d.getClass().getName(), e.toString());
            }
        }
    }

    @Override
    public void onRunStarted(String scenarioId, String runId, List<String> selected, String resumedFrom) {
        each(d -> d.onRunStarted(scenarioId, runId, selected, resumedFrom));
    }

    @Override
    public void onStepStarted(String scenarioId, String runId, String stepId) {
        each(d -> d.onStepStarted(scenarioId, runId, stepId));
    }

    @Override
    public void onStepSucceeded(String scenarioId, String runId, String stepId, StepResult.Outcome outcome, int attempts, long latencyMs) {
        each(d -> d.onStepSucceeded(scenarioId, runId, stepId, outcome, attempts, latencyMs));
    }

    @Override
    public void onStepVerified(String scenarioId, String runId, String stepId, boolean present) {
        each(d -> d.onStepVerified(scenarioId, runId, stepId, present));
    }

    @Override
    public void onStepFailed(String scenarioId, String runId, String stepId, FailureReason reason, int attempts, long latencyMs) {
        each(d -> d.onStepFailed(scenarioId, runId, stepId, reason, attempts, latencyMs));
    }

    @Override
    public void onCancelRequested(String scenarioId, String runId) {
        each(d -> d.onCancelRequested(scenarioId, runId));
    }

    @Override
    public void onRunCompleted(String scenarioId, String runId, RunStatus status, long durationMs) {
        each(d -> d.onRunCompleted(scenarioId, runId, status, durationMs));
    }
}
