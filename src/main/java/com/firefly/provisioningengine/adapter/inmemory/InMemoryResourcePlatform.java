package com.firefly.provisioningengine.adapter.inmemory;

import com.firefly.provisioningengine.exceptions.PermanentAdapterException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simulated resource platform for development and tests. Resources are unique per kind, scope and name; creating
 * one twice is a conflict, as it would be on a real platform. Every create call is recorded.
 */
public class InMemoryResourcePlatform {

    /** A stored resource. */
    public record Resource(String kind, String scope, String name, String id, Map<String, String> attributes) {
        public Resource {
            attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }

    private final Map<String, Resource> resources = new ConcurrentHashMap<>();
    private final List<String> createLog = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<RuntimeException>> failures = new ConcurrentHashMap<>();

    public Optional<Resource> find(String kind, String scope, String name) {
        return Optional.ofNullable(resources.get(key(kind, scope, name)));
    }

    public Optional<Resource> findById(String kind, String id) {
        return resources.values().stream()
                .filter(r -> r.kind().equals(kind) && r.id().equals(id))
                .findFirst();
    }

    public synchronized Resource create(String kind, String scope, String name, Map<String, String> attributes) {
        createLog.add(kind + ":" + name);
        Deque<RuntimeException> queued = failures.get(kind);
        if (queued != null) {
            RuntimeException failure = queued.poll();
            if (failure != null) {
                throw failure;
            }
        }
        String k = key(kind, scope, name);
        if (resources.containsKey(k)) {
            throw new PermanentAdapterException("Conflict: " + kind + " '" + name + "' already exists");
        }
        Resource resource = new Resource(kind, scope, name, UUID.randomUUID().toString(), attributes);
        resources.put(k, resource);
        return resource;
    }

    public boolean delete(String kind, String scope, String name) {
        return resources.remove(key(kind, scope, name)) != null;
    }

    /** Makes the next create call for {@code kind} fail with {@code error}. Calls queue up. */
    public void failNext(String kind, RuntimeException error) {
        failures.computeIfAbsent(kind, k -> new ArrayDeque<>()).add(error);
    }

    public int createCount(String kind) {
        String prefix = kind + ":";
        return (int) createLog.stream().filter(e -> e.startsWith(prefix)).count();
    }

    /** Every create call in order, as {@code kind:name}, including failed ones. */
    public List<String> createLog() {
        return List.copyOf(createLog);
    }

    public List<Resource> resources() {
        return List.copyOf(resources.values());
    }

    public synchronized void reset() {
        resources.clear();
        createLog.clear();
        failures.clear();
    }

    private static String key(String kind, String scope, String name) {
        return kind + "|" + (scope == null ? "" : scope) + "|" + name;
    }
}
