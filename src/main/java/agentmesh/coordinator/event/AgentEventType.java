package agentmesh.coordinator.event;

public enum AgentEventType {
    REGISTERED,
    DEREGISTERED,
    HEALTH_CHANGED
}
