package com.firefly.provisioningengine.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A read query for one scenario. The query text is passed to the resolved backend verbatim (GQL, KQL or SQL
 * depending on the connector).
 */
public record QueryRequest(@JsonProperty("scenario_id") String scenarioId,
                           @JsonProperty("query") String query) {
}
