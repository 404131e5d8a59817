package com.firefly.provisioningengine.registry;

import com.firefly.provisioningengine.core.ScenarioConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Fluent builder for {@link StepGraph}s.
 * <pre>
 * StepGraph graph = StepGraphBuilder.graph("fabric")
 *     .step("workspace").band(ProgressBand.WORKSPACE).adapter("workspace").label("Setting up workspace...").add()
 *     .step("storage").dependsOn("workspace").activeWhen(StepActivation.graphConnector("fabric-gql"))
 *         .band(ProgressBand.STORAGE_PREP).adapter("lakehouse").add()
 *     .build();
 * </pre>
 */
public class StepGraphBuilder {
    private final String name;
    private final Map<String, StepDefinition> steps = new LinkedHashMap<>();

    private StepGraphBuilder(String name) {
        this.name = name;
    }

    public static StepGraphBuilder graph(String name) {
        return new StepGraphBuilder(name);
    }

    public Step step(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("step id");
        return new Step(id);
    }

    public StepGraph build() {
        return new StepGraph(name, steps);
    }

    public class Step {
        private final String id;
        private final List<String> dependsOn = new ArrayList<>();
        private Predicate<ScenarioConfig> activation = StepActivation.always();
        private String adapter;
        private ProgressBand band;
        private String label;
        private String doneLabel;
        private String resourceKind;
        private String dataSource;
        private int retry = 0;
        private Duration backoff = null;
        private Duration timeout = null;

        private Step(String id) {
            this.id = id;
        }

        public Step dependsOn(String... ids) {
            if (ids != null && ids.length > 0) this.dependsOn.addAll(Arrays.asList(ids));
            return this;
        }

        public Step activeWhen(Predicate<ScenarioConfig> activation) {
            if (activation == null) throw new IllegalArgumentException("activation");
            this.activation = activation;
            return this;
        }

        /** Adapter key, resolved through the adapter registry at execution time. Defaults to the step id. */
        public Step adapter(String adapter) { this.adapter = adapter; return this; }
        public Step band(ProgressBand band) { this.band = band; return this; }
        public Step label(String label) { this.label = label; return this; }
        public Step doneLabel(String doneLabel) { this.doneLabel = doneLabel; return this; }
        public Step resourceKind(String resourceKind) { this.resourceKind = resourceKind; return this; }
        public Step dataSource(String category) { this.dataSource = category; return this; }
        public Step retry(int retry) { this.retry = Math.max(0, retry); return this; }
        public Step backoff(Duration backoff) { this.backoff = backoff; return this; }
        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }

        public StepGraphBuilder add() {
            if (steps.containsKey(id)) {
                throw new IllegalStateException("Duplicate step id '" + id + "' in graph '" + name + "'");
            }
            if (band == null) {
                throw new IllegalStateException("Step '" + id + "' has no progress band");
            }
            String key = adapter != null ? adapter : id;
            String startLabel = label != null ? label : id;
            String endLabel = doneLabel != null ? doneLabel : startLabel;
            String kind = resourceKind != null ? resourceKind : key;
            steps.put(id, new StepDefinition(id, dependsOn, activation, key, band, startLabel, endLabel,
                    kind, dataSource, retry, backoff, timeout));
            return StepGraphBuilder.this;
        }
    }
}
