package agentmesh.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Point-in-time registry counters.
 */
public record RegistryStats(
        @JsonProperty("totalAgents") int totalAgents,
        @JsonProperty("agentsByHealth") Map<HealthStatus, Integer> agentsByHealth,
        @JsonProperty("totalCapabilities") int totalCapabilities,
        @JsonProperty("capabilityCoverage") Map<String, Integer> capabilityCoverage) {

    public int count(HealthStatus status) {
        return agentsByHealth.getOrDefault(status, 0);
    }
}
