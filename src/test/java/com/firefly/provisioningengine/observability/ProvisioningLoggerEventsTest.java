package com.firefly.provisioningengine.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.RunStatus;
import com.firefly.provisioningengine.engine.StepResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProvisioningLoggerEventsTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger logger = (Logger) LoggerFactory.getLogger(ProvisioningLoggerEvents.class);
    private final ProvisioningLoggerEvents events = new ProvisioningLoggerEvents();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void lifecycleIsLoggedAsJson() {
        events.onRunStarted("telco-noc", "run-1", List.of("workspace", "finalize"), null);
        events.onStepSucceeded("telco-noc", "run-1", "workspace", StepResult.Outcome.ALREADY_EXISTS, 1, 12);
        events.onRunCompleted("telco-noc", "run-1", RunStatus.SUCCEEDED, 40);

        assertEquals(3, appender.list.size());
        String started = appender.list.get(0).getFormattedMessage();
        assertTrue(started.contains("\"provisioning_event\":\"run_started\""));
        assertTrue(started.contains("\"steps\":\"workspace,finalize\""));
        assertTrue(appender.list.get(1).getFormattedMessage().contains("\"outcome\":\"already_exists\""));
        assertTrue(appender.list.get(2).getFormattedMessage().contains("\"status\":\"succeeded\""));
    }

    @Test
    void failuresAndStaleStepsAreWarnings() {
        events.onStepFailed("telco-noc", "run-1", "tables", FailureReason.transientFailure("tables", "503"), 3, 900);
        events.onStepVerified("telco-noc", "run-2", "storage", false);

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("\"kind\":\"transient\""));
        assertEquals(Level.WARN, appender.list.get(1).getLevel());
        assertTrue(appender.list.get(1).getFormattedMessage().contains("\"provisioning_event\":\"step_stale\""));
    }
}
