package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test adapter whose {@code exists}/{@code create} answers are scripted per call. Unscripted calls fall back to
 * "absent" and "created with id".
 */
class ScriptedAdapter implements ResourceAdapter {
    final String key;
    final Deque<Mono<DiscoveredResource>> existsAnswers = new ArrayDeque<>();
    final Deque<Mono<DiscoveredResource>> createAnswers = new ArrayDeque<>();
    final AtomicInteger existsCalls = new AtomicInteger();
    final AtomicInteger createCalls = new AtomicInteger();
    final AtomicInteger populateCalls = new AtomicInteger();

    ScriptedAdapter(String key) {
        this.key = key;
    }

    ScriptedAdapter existing(DiscoveredResource resource) {
        existsAnswers.add(Mono.just(resource));
        return this;
    }

    ScriptedAdapter existsFails(RuntimeException error) {
        existsAnswers.add(Mono.error(error));
        return this;
    }

    ScriptedAdapter createFails(RuntimeException error) {
        createAnswers.add(Mono.error(error));
        return this;
    }

    ScriptedAdapter createReturns(Mono<DiscoveredResource> answer) {
        createAnswers.add(answer);
        return this;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        existsCalls.incrementAndGet();
        Mono<DiscoveredResource> answer = existsAnswers.poll();
        return answer != null ? answer : Mono.empty();
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        createCalls.incrementAndGet();
        Mono<DiscoveredResource> answer = createAnswers.poll();
        return answer != null ? answer : Mono.just(DiscoveredResource.of(key + "_id", target.name()));
    }

    @Override
    public Mono<Void> populate(ResourceTarget target, DiscoveredResource resource) {
        populateCalls.incrementAndGet();
        return Mono.empty();
    }
}
