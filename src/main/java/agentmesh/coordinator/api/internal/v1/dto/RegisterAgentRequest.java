package agentmesh.coordinator.api.internal.v1.dto;

import agentmesh.coordinator.model.AgentDescriptor;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for agent registration.
 * POST /internal/v1/agents
 */
public record RegisterAgentRequest(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("name") String name,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("version") String version,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("capabilities") Map<String, Double> capabilities) {

    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities must not be empty");
        }
        for (Map.Entry<String, Double> e : capabilities.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("confidence missing for " + e.getKey());
            }
        }
    }

    /** Descriptor validation (confidence range, blank ids) happens in the builder */
    public AgentDescriptor toDescriptor() {
        AgentDescriptor.Builder builder = AgentDescriptor.builder()
                .agentId(agentId)
                .name(name != null ? name : agentId)
                .endpoint(endpoint)
                .capabilities(capabilities);
        if (version != null && !version.isBlank()) {
            builder.version(version);
        }
        if (tags != null) {
            tags.forEach(builder::tag);
        }
        return builder.build();
    }
}
