package agentmesh.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/tasks/{taskId}/dependencies
 */
public record AddDependencyRequest(@JsonProperty("dependsOn") String dependsOn) {

    public void validate() {
        if (dependsOn == null || dependsOn.isBlank()) {
            throw new IllegalArgumentException("dependsOn is required");
        }
    }
}
