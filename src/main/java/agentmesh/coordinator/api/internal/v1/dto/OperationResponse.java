package agentmesh.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("agentId") String agentId,
        @JsonProperty("error") String error) {

    public static OperationResponse success(String agentId) {
        return new OperationResponse(true, agentId, null);
    }

    public static OperationResponse error(String agentId, String error) {
        return new OperationResponse(false, agentId, error);
    }

    public static OperationResponse agentNotFound(String agentId) {
        return error(agentId, "agent_not_found");
    }
}
