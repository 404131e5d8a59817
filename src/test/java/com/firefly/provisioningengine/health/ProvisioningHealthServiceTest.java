package com.firefly.provisioningengine.health;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.InMemoryConfigurationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProvisioningHealthServiceTest {

    private final WorkspaceProbe probe = mock(WorkspaceProbe.class);
    private final AtomicLong nanos = new AtomicLong();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger logger = (Logger) LoggerFactory.getLogger(ProvisioningHealthService.class);

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    private ConfigurationAccessor accessor(Map<String, String> values) {
        return new ConfigurationAccessor(new InMemoryConfigurationStore(values), Map.of(), Duration.ofMinutes(5));
    }

    private ProvisioningHealthService service(ConfigurationAccessor accessor) {
        return new ProvisioningHealthService(accessor, probe, Duration.ofSeconds(30), nanos::get);
    }

    @Test
    void unconfiguredWhenNoWorkspaceIsKnown() {
        HealthStatus status = service(accessor(Map.of())).health().block();

        assertEquals(HealthStatus.unconfigured(), status);
        verifyNoInteractions(probe);
    }

    @Test
    void queryReadyNeedsAConnectedWorkspaceAndAGraphModel() {
        when(probe.reachable("ws-1")).thenReturn(Mono.just(true));
        ConfigurationAccessor accessor = accessor(Map.of(ConfigKeys.WORKSPACE_ID, "ws-1"));
        ProvisioningHealthService service = service(accessor);

        HealthStatus before = service.health().block();
        assertNotNull(before);
        assertTrue(before.configured());
        assertTrue(before.workspaceConnected());
        assertFalse(before.queryReady());

        accessor.write(Map.of(ConfigKeys.GRAPH_MODEL_ID, "gm-1")).block();

        HealthStatus after = service.health().block();
        assertNotNull(after);
        assertTrue(after.queryReady());
        assertEquals("gm-1", after.graphModelId());
    }

    @Test
    void resultIsCachedForTheTtl() {
        when(probe.reachable("ws-1")).thenReturn(Mono.just(true));
        ProvisioningHealthService service = service(accessor(Map.of(ConfigKeys.WORKSPACE_ID, "ws-1")));

        service.health().block();
        service.health().block();
        verify(probe, times(1)).reachable("ws-1");

        nanos.addAndGet(Duration.ofSeconds(31).toNanos());
        service.health().block();
        verify(probe, times(2)).reachable("ws-1");
    }

    @Test
    void probeErrorsReportDisconnectedAndAreLogged() {
        when(probe.reachable("ws-1")).thenReturn(Mono.error(new IllegalStateException("dns failure")));

        HealthStatus status = service(accessor(Map.of(ConfigKeys.WORKSPACE_ID, "ws-1"))).health().block();

        assertNotNull(status);
        assertTrue(status.configured());
        assertFalse(status.workspaceConnected());
        assertFalse(status.queryReady());
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().contains("\"provisioning_health\":\"probe_error\"")));
    }

    @Test
    void statusComputedAcrossAConfigurationWriteIsNotCached() {
        Sinks.One<Boolean> gate = Sinks.one();
        when(probe.reachable("ws-1")).thenReturn(gate.asMono(), Mono.just(true));
        ConfigurationAccessor accessor = accessor(Map.of(ConfigKeys.WORKSPACE_ID, "ws-1"));
        ProvisioningHealthService service = service(accessor);

        Mono<HealthStatus> inFlight = service.health().cache();
        inFlight.subscribe();
        accessor.write(Map.of(ConfigKeys.GRAPH_MODEL_ID, "gm-1")).block();
        gate.tryEmitValue(true);

        HealthStatus stale = inFlight.block();
        assertNotNull(stale);
        assertFalse(stale.queryReady());

        HealthStatus fresh = service.health().block();
        assertNotNull(fresh);
        assertTrue(fresh.queryReady());
        assertEquals("gm-1", fresh.graphModelId());
    }
}
