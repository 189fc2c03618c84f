package agentmesh.coordinator.invoker;

import java.time.Duration;

/**
 * Result of a single health probe.
 *
 * @param latency measured by the transport, or null to let the monitor time the probe
 */
public record HealthSample(boolean healthy, Duration latency, String detail) {

    public static HealthSample healthy(Duration latency) {
        return new HealthSample(true, latency, null);
    }

    public static HealthSample unhealthy(String detail) {
        return new HealthSample(false, null, detail);
    }
}
