package com.firefly.provisioningengine.exceptions;

/**
 * A provisioning request arrived for a scenario that already has a running run. The request is rejected, not queued.
 */
public class RunInProgressException extends ProvisioningException {
    private final String scenarioId;
    private final String runId;

    public RunInProgressException(String scenarioId, String runId) {
        super("Provisioning already in progress for scenario '" + scenarioId + "' (run " + runId + ")");
        this.scenarioId = scenarioId;
        this.runId = runId;
    }

    public String getScenarioId() {
        return scenarioId;
    }

    public String getRunId() {
        return runId;
    }
}
