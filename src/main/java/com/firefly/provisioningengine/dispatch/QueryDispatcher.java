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

package com.firefly.provisioningengine.dispatch;

import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.exceptions.ValidationException;
import com.firefly.provisioningengine.scenario.ScenarioCatalog;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Routes graph and telemetry queries to the backend bound to the scenario's declared connector.
 * <p>
 * The connector is resolved on every call. Scenario and connector problems surface as
 * {@link ValidationException}; anything that goes wrong inside a backend is returned as
 * {@link QueryResult#error(String)}.
 */
public class QueryDispatcher {
    private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);

    private final ScenarioCatalog scenarios;
    private final ConnectorRegistry<GraphBackend> graphBackends;
    private final ConnectorRegistry<TelemetryBackend> telemetryBackends;
    private final ValueNormalizer normalizer;

    public QueryDispatcher(ScenarioCatalog scenarios,
                           ConnectorRegistry<GraphBackend> graphBackends,
                           ConnectorRegistry<TelemetryBackend> telemetryBackends,
                           ValueNormalizer normalizer) {
        this.scenarios = scenarios;
        this.graphBackends = graphBackends;
        this.telemetryBackends = telemetryBackends;
        this.normalizer = normalizer;
    }

    public Mono<QueryResult> graph(QueryRequest request) {
        return dispatch(ScenarioConfig.GRAPH, graphBackends, request);
    }

    public Mono<QueryResult> telemetry(QueryRequest request) {
        return dispatch(ScenarioConfig.TELEMETRY, telemetryBackends, request);
    }

    private <B extends QueryBackend> Mono<QueryResult> dispatch(String category,
                                                              ConnectorRegistry<B> registry,
                                                              QueryRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return Mono.error(new ValidationException("Query must not be empty"));
        }
        return scenarios.resolve(request.scenarioId()).flatMap(config -> {
            DataSourceDeclaration dataSource = config.dataSource(category).orElseThrow(() -> new ValidationException(
                    "Scenario '" + config.scenarioId() + "' declares no " + category + " data source"));
            B backend = registry.resolve(dataSource.connector());
            long start = System.currentTimeMillis();
            return Mono.defer(() -> backend.query(request, dataSource))
                    .map(normalizer::normalize)
                    .doOnSuccess(result -> log.info(JsonUtils.json(
                            "query_dispatch", result != null && result.isError() ? "error_result" : "ok",
                            "category", category,
                            "connector", backend.connector(),
                            "scenario", config.scenarioId(),
                            "latencyMs", Long.toString(System.currentTimeMillis() - start),
                            "query", JsonUtils.safeString(request.query(), 200)
                    )))
                    .onErrorResume(err -> !(err instanceof ValidationException), err -> {
                        log.warn(JsonUtils.json(
                                "query_dispatch", "backend_error",
                                "category", category,
                                "connector", backend.connector(),
                                "scenario", config.scenarioId(),
                                "error_class", err.getClass().getName(),
                                "error_msg", JsonUtils.errorMessage(err, 500)
                        ));
                        return Mono.just(QueryResult.error(category + " query error: "
                                + JsonUtils.errorMessage(err, 500) + ". Read the error, fix the query, and retry."));
                    });
        });
    }
}
