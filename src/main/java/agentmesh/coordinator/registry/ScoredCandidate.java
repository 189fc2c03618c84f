package agentmesh.coordinator.registry;

import agentmesh.coordinator.model.HealthStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A routing candidate with the inputs and result of its score.
 */
public record ScoredCandidate(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("health") HealthStatus health,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("normalizedLatency") double normalizedLatency,
        @JsonProperty("preferenceBonus") double preferenceBonus,
        @JsonProperty("score") double score) {
}
