package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.CancelResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CancelResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("result") CancelResult result) {
}
