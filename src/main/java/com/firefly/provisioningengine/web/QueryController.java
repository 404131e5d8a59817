package com.firefly.provisioningengine.web;

import com.firefly.provisioningengine.dispatch.QueryDispatcher;
import com.firefly.provisioningengine.dispatch.QueryRequest;
import com.firefly.provisioningengine.dispatch.QueryResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Query endpoints. Backend failures come back as 200 with an {@code error} field; bad requests are 400.
 */
@RestController
@RequestMapping("/api/query")
public class QueryController {
    private final QueryDispatcher dispatcher;

    public QueryController(QueryDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/graph")
    public Mono<QueryResult> graph(@RequestBody QueryRequest request) {
        return dispatcher.graph(request);
    }

    @PostMapping("/telemetry")
    public Mono<QueryResult> telemetry(@RequestBody QueryRequest request) {
        return dispatcher.telemetry(request);
    }
}
