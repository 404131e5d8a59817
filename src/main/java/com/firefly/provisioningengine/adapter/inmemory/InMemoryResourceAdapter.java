package com.firefly.provisioningengine.adapter.inmemory;

import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Resource adapter backed by an {@link InMemoryResourcePlatform}.
 * <p>
 * The resource is scoped by the identifier of its parent (e.g. a lakehouse by its workspace id), which an
 * earlier step must have discovered. Discovered values are the resource id, optionally its name, and any
 * derived attributes.
 */
public class InMemoryResourceAdapter implements ResourceAdapter {
    private final String key;
    private final InMemoryResourcePlatform platform;
    private final String scopeKey;
    private final String idKey;
    private final String nameKey;
    private final Map<String, BiFunction<ResourceTarget, String, String>> attributes;

    protected InMemoryResourceAdapter(Builder b) {
        this.key = b.key;
        this.platform = b.platform;
        this.scopeKey = b.scopeKey;
        this.idKey = b.idKey;
        this.nameKey = b.nameKey;
        this.attributes = Map.copyOf(b.attributes);
    }

    public static Builder builder(String key, InMemoryResourcePlatform platform) {
        return new Builder(key, platform);
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        return Mono.fromCallable(() -> scope(target))
                .flatMap(scope -> Mono.justOrEmpty(platform.find(key, scope, target.name())))
                .map(this::toDiscovered);
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        return Mono.fromCallable(() -> {
            String scope = scope(target);
            Map<String, String> attrs = new LinkedHashMap<>();
            // id is not known before create; attribute functions receive the name instead
            attributes.forEach((k, fn) -> attrs.put(k, fn.apply(target, target.name())));
            return toDiscovered(platform.create(key, scope, target.name(), attrs));
        });
    }

    private String scope(ResourceTarget target) {
        return scopeKey == null ? null : target.require(scopeKey);
    }

    private DiscoveredResource toDiscovered(InMemoryResourcePlatform.Resource resource) {
        Map<String, String> values = new LinkedHashMap<>();
        if (idKey != null) values.put(idKey, resource.id());
        if (nameKey != null) values.put(nameKey, resource.name());
        values.putAll(resource.attributes());
        return DiscoveredResource.of(values);
    }

    public static final class Builder {
        private final String key;
        private final InMemoryResourcePlatform platform;
        private String scopeKey;
        private String idKey;
        private String nameKey;
        private final Map<String, BiFunction<ResourceTarget, String, String>> attributes = new LinkedHashMap<>();

        private Builder(String key, InMemoryResourcePlatform platform) {
            this.key = key;
            this.platform = platform;
        }

        public Builder scopedBy(String scopeKey) { this.scopeKey = scopeKey; return this; }

        public Builder id(String idKey) { this.idKey = idKey; return this; }

        public Builder name(String nameKey) { this.nameKey = nameKey; return this; }

        public Builder attribute(String key, BiFunction<ResourceTarget, String, String> value) {
            this.attributes.put(key, value);
            return this;
        }

        public InMemoryResourceAdapter build() {
            return new InMemoryResourceAdapter(this);
        }
    }
}
