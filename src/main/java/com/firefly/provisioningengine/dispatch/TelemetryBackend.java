package com.firefly.provisioningengine.dispatch;

/** Backend for time-series telemetry queries. */
public interface TelemetryBackend extends QueryBackend {
}
