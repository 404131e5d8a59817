package com.firefly.provisioningengine.scenario;

import com.firefly.provisioningengine.exceptions.ValidationException;

import java.util.regex.Pattern;

public final class ScenarioIds {
    private static final Pattern VALID = Pattern.compile("[a-z0-9][a-z0-9-]{0,62}");

    private ScenarioIds() {
    }

    public static String requireValid(String scenarioId) {
        if (scenarioId == null || !VALID.matcher(scenarioId).matches()) {
            throw new ValidationException("Invalid scenario id '" + scenarioId
                    + "': expected lowercase letters, digits and hyphens (max 63 characters)");
        }
        return scenarioId;
    }
}
