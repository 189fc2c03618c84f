package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.Priority;
import agentmesh.coordinator.model.Task;
import agentmesh.coordinator.model.TaskError;
import agentmesh.coordinator.model.TaskState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for task details.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("contextId") String contextId,
        @JsonProperty("capabilityId") String capabilityId,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("state") TaskState state,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("dependents") List<String> dependents,
        @JsonProperty("assignedAgent") String assignedAgent,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("payload") String payload,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("result") String result,
        @JsonProperty("error") TaskError error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("executionTimeMs") Long executionTimeMs) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.contextId(),
                task.capabilityId(),
                task.priority(),
                task.state(),
                task.dependencies(),
                task.dependents(),
                task.assignedAgent(),
                task.retryCount(),
                task.maxRetries(),
                task.timeout() != null ? task.timeout().toMillis() : null,
                task.payload(),
                task.metadata(),
                task.result(),
                task.error(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.executionTimeMs());
    }
}
