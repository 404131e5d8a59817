package com.firefly.provisioningengine.annotations;

import com.firefly.provisioningengine.config.ProvisioningEngineConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the provisioning engine in a Spring application.
 * <p>
 * Imports {@link ProvisioningEngineConfiguration} that wires:
 * - {@code ProvisioningEngine}: the step graph executor with resume and cancellation
 * - the resource adapters of the configured platform ({@code in-memory} or {@code fabric})
 * - {@code ConfigurationAccessor}: cached access to the shared configuration store
 * - {@code QueryDispatcher}: connector-based graph and telemetry query routing
 * - {@code ProvisioningHealthService} and its Actuator indicator
 * - {@code ProvisioningEvents}: logging sink, plus Micrometer when a {@code MeterRegistry} exists
 * - {@code AdapterLoggingAspect}: adapter call logging
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(ProvisioningEngineConfiguration.class)
public @interface EnableProvisioningEngine {
}
