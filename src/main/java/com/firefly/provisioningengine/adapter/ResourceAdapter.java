package com.firefly.provisioningengine.adapter;

import reactor.core.publisher.Mono;

/**
 * Uniform capability for one kind of platform resource.
 * <p>
 * Implementations must be scoped strictly by the {@link ResourceTarget}: {@code exists} and {@code create}
 * for the same target refer to the same resource. {@code exists} completes empty when the resource is absent.
 * Errors may be raised as {@link com.firefly.provisioningengine.exceptions.TransientAdapterException} or
 * {@link com.firefly.provisioningengine.exceptions.PermanentAdapterException}; anything else is classified
 * by the engine.
 */
public interface ResourceAdapter {

    /** Registry key; steps refer to adapters by this name. */
    String key();

    Mono<DiscoveredResource> exists(ResourceTarget target);

    Mono<DiscoveredResource> create(ResourceTarget target);

    /** Loads data into a freshly created resource. Not called when the resource already existed. */
    default Mono<Void> populate(ResourceTarget target, DiscoveredResource resource) {
        return Mono.empty();
    }
}
