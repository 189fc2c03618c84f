package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.Priority;
import agentmesh.coordinator.model.RoutingPreferences;
import agentmesh.coordinator.model.TaskRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 *
 * {@code payload} may be any JSON value; strings are passed through as-is,
 * anything else is forwarded as its JSON text. {@code routing} carries
 * optional preferred agent tags and version.
 */
public record CreateTaskRequest(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("capabilityId") String capabilityId,
        @JsonProperty("contextId") String contextId,
        @JsonProperty("priority") String priority,
        @JsonProperty("dependsOn") List<String> dependsOn,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("routing") RoutingPreferences routing) {

    /** Validate the request shape; the task manager checks the rest */
    public void validate() {
        if (capabilityId == null || capabilityId.isBlank()) {
            throw new IllegalArgumentException("capabilityId is required");
        }
        if (contextId == null || contextId.isBlank()) {
            throw new IllegalArgumentException("contextId is required");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (dependsOn != null && dependsOn.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("dependsOn must not contain null");
        }
        if (metadata != null && metadata.values().stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("metadata values must not be null");
        }
        if (routing != null && routing.tags().contains(null)) {
            throw new IllegalArgumentException("routing tags must not contain null");
        }
        parsePriority();
    }

    /** Missing priority means MEDIUM */
    public Priority parsePriority() {
        if (priority == null || priority.isBlank()) {
            return Priority.MEDIUM;
        }
        try {
            return Priority.valueOf(priority.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + priority);
        }
    }

    public TaskRequest toTaskRequest() {
        String payloadText = null;
        if (payload != null && !payload.isNull()) {
            payloadText = payload.isTextual() ? payload.asText() : payload.toString();
        }
        return TaskRequest.builder(capabilityId, contextId, parsePriority())
                .taskId(taskId)
                .dependencies(dependsOn)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .maxRetries(maxRetries)
                .payload(payloadText)
                .metadata(metadata)
                .routing(routing)
                .build();
    }
}
