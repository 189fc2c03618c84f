package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.ManagerStats;
import agentmesh.coordinator.model.RegistryStats;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /api/v1/stats
 */
public record StatsResponse(
        @JsonProperty("tasks") ManagerStats tasks,
        @JsonProperty("agents") RegistryStats agents) {
}
