package agentmesh.coordinator.event;

import agentmesh.coordinator.model.HealthStatus;

import java.time.Instant;

/**
 * Agent registry change.
 *
 * @param previousHealth health before a HEALTH_CHANGED, null otherwise
 */
public record AgentEvent(
        AgentEventType type,
        String agentId,
        HealthStatus health,
        HealthStatus previousHealth,
        Instant timestamp) implements CoordinatorEvent {
}
