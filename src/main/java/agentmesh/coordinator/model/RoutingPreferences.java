package agentmesh.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Soft routing hints for a task. Agents carrying one of the preferred tags,
 * or running the preferred version, score higher; no agent is excluded.
 */
public record RoutingPreferences(
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("version") String version) {

    public static final RoutingPreferences NONE = new RoutingPreferences(Set.of(), null);

    public RoutingPreferences {
        tags = tags == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        version = version == null || version.isBlank() ? null : version.trim();
    }

    public static RoutingPreferences of(Set<String> tags, String version) {
        RoutingPreferences prefs = new RoutingPreferences(tags, version);
        return prefs.isEmpty() ? NONE : prefs;
    }

    public boolean isEmpty() {
        return tags.isEmpty() && version == null;
    }

    public boolean matchesTag(AgentDescriptor agent) {
        for (String tag : tags) {
            if (agent.tags().contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesVersion(AgentDescriptor agent) {
        return version != null && version.equals(agent.version());
    }
}
