package agentmesh.coordinator.model;

/**
 * An agent declaring a requested capability, with its declared confidence.
 */
public record CapabilityCandidate(AgentDescriptor agent, double confidence) {

    public String agentId() {
        return agent.agentId();
    }

    public HealthStatus healthStatus() {
        return agent.healthStatus();
    }
}
