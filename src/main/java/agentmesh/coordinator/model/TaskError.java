package agentmesh.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Last error recorded on a task.
 */
public record TaskError(
        @JsonProperty("kind") ErrorKind kind,
        @JsonProperty("message") String message) {

    public TaskError {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static TaskError dependencyCancelled(String sourceTaskId) {
        return new TaskError(ErrorKind.CANCELLED, "dependency_cancelled: " + sourceTaskId);
    }

    public static TaskError cancelled() {
        return new TaskError(ErrorKind.CANCELLED, "cancelled by caller");
    }
}
