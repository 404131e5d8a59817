package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.core.RunSnapshot;
import com.firefly.provisioningengine.core.RunStatus;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.exceptions.ValidationException;
import com.firefly.provisioningengine.registry.StepDefinition;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the {@link RunState} for a new request, seeding it from a failed prior run when the request asks to
 * resume.
 * <p>
 * A resumed run copies the prior run's completed steps and their discovered identifiers verbatim. The selection
 * is re-derived from the current configuration; completed steps that are no longer selected are dropped.
 */
public class ResumeController {
    private static final Logger log = LoggerFactory.getLogger(ResumeController.class);

    public RunState plan(String runId,
                         ProvisioningRequest request,
                         ScenarioConfig config,
                         List<StepDefinition> selection,
                         Map<String, String> baseValues,
                         Optional<RunState> latest) {
        if (!request.isRetry()) {
            return fresh(runId, config, selection, baseValues, request.overrides());
        }
        RunState failed = latest.filter(r -> r.status() == RunStatus.FAILED).orElse(null);
        if (failed == null) {
            log.warn(JsonUtils.json(
                    "provisioning_resume", "no_prior_failure",
                    "scenario", config.scenarioId(),
                    "retryFrom", request.retryFrom()
            ));
            return fresh(runId, config, selection, baseValues, request.overrides());
        }
        String failedAt = failed.failure() != null ? failed.failure().stepId() : failed.currentStep();
        if (failedAt != null && !failedAt.equals(request.retryFrom())) {
            throw new ValidationException("Cannot retry from '" + request.retryFrom() + "': run " + failed.runId()
                    + " failed at '" + failedAt + "'");
        }
        return resume(runId, failed, config, selection, baseValues, request.overrides());
    }

    public RunState fresh(String runId,
                          ScenarioConfig config,
                          List<StepDefinition> selection,
                          Map<String, String> baseValues,
                          Map<String, String> overrides) {
        return new RunState(runId, config, ids(selection), baseValues, overrides, null);
    }

    public RunState resume(String runId,
                           RunState prior,
                           ScenarioConfig config,
                           List<StepDefinition> selection,
                           Map<String, String> baseValues,
                           Map<String, String> overrides) {
        List<String> selected = ids(selection);
        RunState next = new RunState(runId, config, selected, baseValues, overrides, prior.runId());
        RunSnapshot previous = prior.snapshot();
        for (String stepId : previous.completed()) {
            if (selected.contains(stepId)) {
                next.seedCompleted(stepId, previous.discovered().getOrDefault(stepId, Map.of()));
            } else {
                log.info(JsonUtils.json(
                        "provisioning_resume", "step_no_longer_selected",
                        "scenario", config.scenarioId(),
                        "stepId", stepId
                ));
            }
        }
        log.info(JsonUtils.json(
                "provisioning_resume", "seeded",
                "scenario", config.scenarioId(),
                "runId", runId,
                "resumedFrom", prior.runId(),
                "completed", String.join(",", next.completed())
        ));
        return next;
    }

    private static List<String> ids(List<StepDefinition> selection) {
        return selection.stream().map(s -> s.id).toList();
    }
}
