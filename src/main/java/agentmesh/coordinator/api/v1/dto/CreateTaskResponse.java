package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.TaskState;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a task submission.
 */
public record CreateTaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("state") TaskState state) {
}
