package agentmesh.coordinator.event;

import agentmesh.coordinator.model.TaskError;
import agentmesh.coordinator.model.TaskState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Task state change, or an anomaly observed on a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEvent(
        @JsonProperty("type") TaskEventType type,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("contextId") String contextId,
        @JsonProperty("state") TaskState state,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("agentId") String agentId,
        @JsonProperty("error") TaskError error,
        @JsonProperty("detail") String detail,
        @JsonProperty("timestamp") Instant timestamp) implements CoordinatorEvent {

    @JsonIgnore
    public boolean isTerminal() {
        return type != TaskEventType.ANOMALY && state != null && state.isTerminal();
    }
}
