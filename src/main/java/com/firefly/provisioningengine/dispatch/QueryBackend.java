package com.firefly.provisioningengine.dispatch;

import com.firefly.provisioningengine.core.DataSourceDeclaration;
import reactor.core.publisher.Mono;

/**
 * A query backend bound to one connector name. Backends read whatever configuration they need (workspace ids,
 * endpoints) at query time, never at construction, so newly provisioned resources are picked up without a restart.
 */
public interface QueryBackend {

    /** Connector name as declared in scenario configuration, e.g. {@code fabric-gql}. */
    String connector();

    /**
     * @param dataSource the scenario's declaration for this backend's category, with its connector parameters
     */
    Mono<QueryResult> query(QueryRequest request, DataSourceDeclaration dataSource);
}
