package agentmesh.coordinator.model;

/**
 * Agent health as last written by the health monitor.
 */
public enum HealthStatus {
    /** Registered, not probed yet */
    UNKNOWN,
    HEALTHY,
    /** Failed recent probes, still eligible as a fallback */
    DEGRADED,
    /** Failed too many consecutive probes, never routed to */
    UNREACHABLE
}
