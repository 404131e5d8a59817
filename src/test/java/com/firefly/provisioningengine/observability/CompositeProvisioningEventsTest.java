package com.firefly.provisioningengine.observability;

import com.firefly.provisioningengine.core.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.Mockito.*;

class CompositeProvisioningEventsTest {

    @Test
    void failingSinkDoesNotStopTheOthers() {
        ProvisioningEvents broken = mock(ProvisioningEvents.class);
        ProvisioningEvents healthy = mock(ProvisioningEvents.class);
        doThrow(new IllegalStateException("sink down")).when(broken).onRunCompleted(any(), any(), any(), anyLong());
        CompositeProvisioningEvents composite = new CompositeProvisioningEvents(List.of(broken, healthy));

        composite.onRunCompleted("telco-noc", "run-1", RunStatus.FAILED, 10);
        composite.onCancelRequested("telco-noc", "run-1");

        verify(healthy).onRunCompleted("telco-noc", "run-1", RunStatus.FAILED, 10);
        verify(healthy).onCancelRequested("telco-noc", "run-1");
        verify(broken).onCancelRequested("telco-noc", "run-1");
    }
}
