package com.firefly.provisioningengine.dispatch;

/** Backend for graph queries (topology, relationships). */
public interface GraphBackend extends QueryBackend {
}
