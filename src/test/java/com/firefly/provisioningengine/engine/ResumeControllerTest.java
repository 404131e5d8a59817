package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.core.StepStatus;
import com.firefly.provisioningengine.exceptions.ValidationException;
import com.firefly.provisioningengine.registry.StandardStepGraph;
import com.firefly.provisioningengine.registry.StepDefinition;
import com.firefly.provisioningengine.registry.StepGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResumeControllerTest {

    private final ResumeController controller = new ResumeController();
    private final StepGraph graph = StandardStepGraph.create();
    private final ScenarioConfig both = ScenarioConfig.builder("telco-noc")
            .dataSource(ScenarioConfig.GRAPH, Connectors.FABRIC_GQL)
            .dataSource(ScenarioConfig.TELEMETRY, Connectors.FABRIC_KQL)
            .build();

    private RunState failedAt(String failedStep, String... completed) {
        List<StepDefinition> selection = graph.select(both);
        RunState prior = controller.fresh("run-1", both, selection, Map.of(), Map.of());
        for (String id : completed) {
            prior.complete(id, StepStatus.CREATED, Map.of("ID_" + id, id + "-1"), 0, null);
        }
        prior.fail(FailureReason.permanent(failedStep, "boom"));
        return prior;
    }

    @Test
    void noRetryMarkerMeansFreshRun() {
        RunState prior = failedAt(StandardStepGraph.STORAGE, StandardStepGraph.WORKSPACE);

        RunState next = controller.plan("run-2", ProvisioningRequest.of("telco-noc"), both, graph.select(both),
                Map.of(), Optional.of(prior));

        assertNull(next.resumedFrom());
        assertTrue(next.completed().isEmpty());
    }

    @Test
    void resumeSeedsCompletedStepsAndTheirIdentifiers() {
        RunState prior = failedAt(StandardStepGraph.UPLOAD, StandardStepGraph.WORKSPACE, StandardStepGraph.STORAGE);

        RunState next = controller.plan("run-2",
                new ProvisioningRequest("telco-noc", Map.of(), StandardStepGraph.UPLOAD),
                both, graph.select(both), Map.of(), Optional.of(prior));

        assertEquals("run-1", next.resumedFrom());
        assertEquals(List.of(StandardStepGraph.WORKSPACE, StandardStepGraph.STORAGE), next.completed());
        assertEquals("storage-1", next.discoveredValues().get("ID_storage"));
        assertEquals(StepStatus.PENDING, next.snapshot().steps().get(StandardStepGraph.STORAGE));
    }

    @Test
    void mismatchedRetryMarkerIsRejected() {
        RunState prior = failedAt(StandardStepGraph.UPLOAD, StandardStepGraph.WORKSPACE, StandardStepGraph.STORAGE);
        ProvisioningRequest request = new ProvisioningRequest("telco-noc", Map.of(), StandardStepGraph.TABLES);

        assertThrows(ValidationException.class, () -> controller.plan("run-2", request, both,
                graph.select(both), Map.of(), Optional.of(prior)));
    }

    @Test
    void retryWithoutFailedRunStartsFresh() {
        RunState next = controller.plan("run-2",
                new ProvisioningRequest("telco-noc", Map.of(), StandardStepGraph.UPLOAD),
                both, graph.select(both), Map.of(), Optional.empty());

        assertNull(next.resumedFrom());
    }

    @Test
    void completedStepsThatAreNoLongerSelectedAreDropped() {
        RunState prior = failedAt(StandardStepGraph.TIMESERIES_INGEST,
                StandardStepGraph.WORKSPACE, StandardStepGraph.TIMESERIES_DB);
        ScenarioConfig graphOnly = ScenarioConfig.builder("telco-noc")
                .dataSource(ScenarioConfig.GRAPH, Connectors.FABRIC_GQL)
                .build();

        RunState next = controller.plan("run-2",
                new ProvisioningRequest("telco-noc", Map.of(), StandardStepGraph.TIMESERIES_INGEST),
                graphOnly, graph.select(graphOnly), Map.of(), Optional.of(prior));

        assertEquals(List.of(StandardStepGraph.WORKSPACE), next.completed());
    }
}
