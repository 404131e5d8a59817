package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.exceptions.RunInProgressException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-scenario run bookkeeping within this process.
 * <p>
 * At most one running run per scenario: {@link #begin} fails fast with {@link RunInProgressException} instead of
 * queuing. The most recent run is retained after it finishes so it can be inspected and resumed; starting a new
 * run supersedes it.
 */
public class RunRegistry {
    private final Map<String, ActiveRun> runs = new ConcurrentHashMap<>();

    /**
     * Atomically checks for a running run and registers the one built by {@code factory}, which receives the
     * scenario's latest finished run, if any.
     */
    public synchronized ActiveRun begin(String scenarioId, Function<Optional<RunState>, ActiveRun> factory) {
        ActiveRun existing = runs.get(scenarioId);
        if (existing != null && existing.state().isRunning()) {
            throw new RunInProgressException(scenarioId, existing.state().runId());
        }
        ActiveRun next = factory.apply(Optional.ofNullable(existing).map(ActiveRun::state));
        runs.put(scenarioId, next);
        return next;
    }

    public Optional<ActiveRun> find(String scenarioId) {
        return Optional.ofNullable(runs.get(scenarioId));
    }

    public Optional<ActiveRun> running(String scenarioId) {
        return find(scenarioId).filter(r -> r.state().isRunning());
    }

    public Optional<RunState> latest(String scenarioId) {
        return find(scenarioId).map(ActiveRun::state);
    }

    public Collection<ActiveRun> all() {
        return List.copyOf(runs.values());
    }
}
