package com.firefly.provisioningengine.registry;

import com.firefly.provisioningengine.core.ScenarioConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static, validated set of provisioning steps.
 * <p>
 * The graph is a DAG checked at construction time (unknown dependencies, duplicates and cycles are rejected).
 * Its topological order is computed once with Kahn's algorithm, breaking ties by declaration order, so
 * {@link #select(ScenarioConfig)} is a pure, deterministic function of the configuration.
 */
public class StepGraph {
    private final String name;
    private final Map<String, StepDefinition> steps;
    private final List<String> order;

    StepGraph(String name, Map<String, StepDefinition> steps) {
        this.name = Objects.requireNonNull(name, "name");
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        validate(this.name, this.steps);
        this.order = List.copyOf(topologicalOrder(this.steps));
    }

    public String name() {
        return name;
    }

    public Map<String, StepDefinition> steps() {
        return steps;
    }

    public StepDefinition step(String id) {
        StepDefinition sd = steps.get(id);
        if (sd == null) {
            throw new IllegalArgumentException("Unknown step '" + id + "' in graph '" + name + "'");
        }
        return sd;
    }

    public boolean contains(String id) {
        return steps.containsKey(id);
    }

    /** Every step in topological order, regardless of activation. */
    public List<String> order() {
        return order;
    }

    /**
     * Steps that run for {@code config}, in topological order. A step is selected when its predicate holds
     * and every one of its dependencies is itself selected; a dependency is a hard precondition.
     */
    public List<StepDefinition> select(ScenarioConfig config) {
        Objects.requireNonNull(config, "config");
        Set<String> selected = new HashSet<>();
        List<StepDefinition> out = new ArrayList<>();
        for (String id : order) {
            StepDefinition sd = steps.get(id);
            if (!sd.isActive(config)) continue;
            if (!selected.containsAll(sd.dependsOn)) continue;
            selected.add(id);
            out.add(sd);
        }
        return Collections.unmodifiableList(out);
    }

    public List<String> selectIds(ScenarioConfig config) {
        return select(config).stream().map(sd -> sd.id).toList();
    }

    public String describe() {
        return String.join(" -> ", order);
    }

    private static void validate(String graph, Map<String, StepDefinition> steps) {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Step graph '" + graph + "' has no steps");
        }
        for (StepDefinition sd : steps.values()) {
            if (sd.adapter == null || sd.adapter.isBlank()) {
                throw new IllegalStateException("Step '" + sd.id + "' in graph '" + graph + "' has no adapter");
            }
            for (String dep : sd.dependsOn) {
                if (dep.equals(sd.id)) {
                    throw new IllegalStateException("Step '" + sd.id + "' depends on itself");
                }
                if (!steps.containsKey(dep)) {
                    throw new IllegalStateException("Step '" + sd.id + "' depends on unknown step '" + dep + "'");
                }
            }
        }
    }

    private static List<String> topologicalOrder(Map<String, StepDefinition> steps) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (String id : steps.keySet()) {
            indegree.put(id, 0);
            adj.put(id, new ArrayList<>());
        }
        for (StepDefinition sd : steps.values()) {
            for (String dep : new LinkedHashSet<>(sd.dependsOn)) {
                indegree.merge(sd.id, 1, Integer::sum);
                adj.get(dep).add(sd.id);
            }
        }
        List<String> out = new ArrayList<>(steps.size());
        Set<String> emitted = new HashSet<>();
        while (out.size() < steps.size()) {
            String next = null;
            // earliest declared step whose dependencies are all emitted
            for (String id : steps.keySet()) {
                if (!emitted.contains(id) && indegree.get(id) == 0) {
                    next = id;
                    break;
                }
            }
            if (next == null) {
                List<String> remaining = steps.keySet().stream().filter(id -> !emitted.contains(id)).toList();
                throw new IllegalStateException("Cycle detected among steps " + remaining);
            }
            emitted.add(next);
            out.add(next);
            for (String v : adj.get(next)) {
                indegree.merge(v, -1, Integer::sum);
            }
        }
        return out;
    }
}
