package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.HealthStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response DTO for agent information.
 * GET /api/v1/agents, GET /api/v1/agents/{agentId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResponse(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("name") String name,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("version") String version,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("capabilities") Map<String, Double> capabilities,
        @JsonProperty("healthStatus") HealthStatus healthStatus,
        @JsonProperty("lastProbeTime") Instant lastProbeTime,
        @JsonProperty("avgResponseTimeMs") Double avgResponseTimeMs,
        @JsonProperty("registeredAt") Instant registeredAt) {

    public static AgentResponse from(AgentDescriptor agent) {
        return new AgentResponse(
                agent.agentId(),
                agent.name(),
                agent.endpoint(),
                agent.version(),
                agent.tags().stream().sorted().toList(),
                new TreeMap<>(agent.capabilities()),
                agent.healthStatus(),
                agent.lastProbeTime(),
                agent.avgResponseTimeMs(),
                agent.registeredAt());
    }
}
