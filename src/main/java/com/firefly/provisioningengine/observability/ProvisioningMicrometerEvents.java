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
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;

/**
 * Micrometer-based implementation of ProvisioningEvents publishing counters, timers
 * and distribution summaries for steps and runs.
 */
public class ProvisioningMicrometerEvents implements ProvisioningEvents {
    private final MeterRegistry registry;

    public ProvisioningMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onRunStarted(String scenarioId, String runId, List<String> selected, String resumedFrom) {
        registry.counter("provisioning.run.started",
                Tags.of(Tag.of("scenario", scenarioId), Tag.of("resumed", String.valueOf(resumedFrom != null)))).increment();
    }

    @Override
    public void onStepStarted(String scenarioId, String runId, String stepId) {
        registry.counter("provisioning.step.started", Tags.of(Tag.of("scenario", scenarioId), Tag.of("step", stepId))).increment();
    }

    @Override
    public void onStepSucceeded(String scenarioId, String runId, String stepId, StepResult.Outcome outcome, int attempts, long latencyMs) {
        record(scenarioId, stepId, outcome.name().toLowerCase(), attempts, latencyMs);
    }

    @Override
    public void onStepVerified(String scenarioId, String runId, String stepId, boolean present) {
        registry.counter("provisioning.step.verified",
                Tags.of(Tag.of("scenario", scenarioId), Tag.of("step", stepId), Tag.of("present", String.valueOf(present)))).increment();
    }

    @Override
    public void onStepFailed(String scenarioId, String runId, String stepId, FailureReason reason, int attempts, long latencyMs) {
        record(scenarioId, stepId, "failed_" + reason.kind().wireName(), attempts, latencyMs);
    }

    @Override
    public void onRunCompleted(String scenarioId, String runId, RunStatus status, long durationMs) {
        Tags tags = Tags.of(Tag.of("scenario", scenarioId), Tag.of("status", status.wireName()));
        registry.counter("provisioning.run.completed", tags).increment();
        Timer.builder("provisioning.run.duration")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, durationMs)));
    }

    private void record(String scenarioId, String stepId, String outcome, int attempts, long latencyMs) {
        Tags tags = Tags.of(Tag.of("scenario", scenarioId), Tag.of("step", stepId), Tag.of("outcome", outcome));
        registry.counter("provisioning.step.completed", tags).increment();
        Timer.builder("provisioning.step.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, latencyMs)));
        DistributionSummary.builder("provisioning.step.attempts")
                .baseUnit("attempts")
                .tags(tags)
                .register(registry)
                .record(Math.max(0, attempts));
    }
}
