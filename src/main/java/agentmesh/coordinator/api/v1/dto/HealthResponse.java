package agentmesh.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("agents") int agents,
        @JsonProperty("healthyAgents") int healthyAgents,
        @JsonProperty("queuedTasks") int queuedTasks,
        @JsonProperty("runningTasks") int runningTasks) {

    public static HealthResponse healthy(String uptime, String version, int agents, int healthyAgents,
            int queuedTasks, int runningTasks) {
        return new HealthResponse("healthy", uptime, version, agents, healthyAgents, queuedTasks, runningTasks);
    }
}
