package agentmesh.coordinator.model;

import agentmesh.coordinator.error.ValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model of a registered agent: identity, declared
 * capabilities with confidence, and the last health snapshot.
 */
public final class AgentDescriptor {
    private final String agentId;
    private final String name;
    private final String endpoint;
    private final String version;
    private final Set<String> tags;
    private final Map<String, Double> capabilities;
    private final HealthStatus healthStatus;
    private final Instant lastProbeTime;
    private final Double avgResponseTimeMs;
    private final Instant registeredAt;

    private AgentDescriptor(Builder builder) {
        if (builder.agentId == null || builder.agentId.isBlank()) {
            throw new ValidationException("agentId is required");
        }
        for (Map.Entry<String, Double> e : builder.capabilities.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new ValidationException("capability id must not be blank");
            }
            Double confidence = e.getValue();
            if (confidence == null || confidence < 0.0 || confidence > 1.0 || confidence.isNaN()) {
                throw new ValidationException("confidence for " + e.getKey() + " must be within [0, 1]");
            }
        }
        this.agentId = builder.agentId;
        this.name = builder.name != null ? builder.name : builder.agentId;
        this.endpoint = builder.endpoint;
        this.version = builder.version;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(builder.capabilities));
        this.healthStatus = Objects.requireNonNull(builder.healthStatus, "healthStatus is required");
        this.lastProbeTime = builder.lastProbeTime;
        this.avgResponseTimeMs = builder.avgResponseTimeMs;
        this.registeredAt = builder.registeredAt;
    }

    // Getters
    public String agentId() {
        return agentId;
    }

    public String name() {
        return name;
    }

    public String endpoint() {
        return endpoint;
    }

    public String version() {
        return version;
    }

    public Set<String> tags() {
        return tags;
    }

    public Map<String, Double> capabilities() {
        return capabilities;
    }

    public HealthStatus healthStatus() {
        return healthStatus;
    }

    public Instant lastProbeTime() {
        return lastProbeTime;
    }

    public Double avgResponseTimeMs() {
        return avgResponseTimeMs;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public boolean declares(String capabilityId) {
        return capabilities.containsKey(capabilityId);
    }

    /** Declared confidence for a capability, or 0 if not declared */
    public double confidenceFor(String capabilityId) {
        return capabilities.getOrDefault(capabilityId, 0.0);
    }

    /** Create a builder from this agent (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .agentId(agentId)
                .name(name)
                .endpoint(endpoint)
                .version(version)
                .tags(tags)
                .capabilities(capabilities)
                .healthStatus(healthStatus)
                .lastProbeTime(lastProbeTime)
                .avgResponseTimeMs(avgResponseTimeMs)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String agentId;
        private String name;
        private String endpoint;
        private String version = "1.0.0";
        private Set<String> tags = new LinkedHashSet<>();
        private Map<String, Double> capabilities = new LinkedHashMap<>();
        private HealthStatus healthStatus = HealthStatus.UNKNOWN;
        private Instant lastProbeTime;
        private Double avgResponseTimeMs;
        private Instant registeredAt;

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder capabilities(Map<String, Double> capabilities) {
            this.capabilities = capabilities == null ? new LinkedHashMap<>() : new LinkedHashMap<>(capabilities);
            return this;
        }

        public Builder capability(String capabilityId, double confidence) {
            this.capabilities.put(capabilityId, confidence);
            return this;
        }

        public Builder healthStatus(HealthStatus healthStatus) {
            this.healthStatus = healthStatus;
            return this;
        }

        public Builder lastProbeTime(Instant lastProbeTime) {
            this.lastProbeTime = lastProbeTime;
            return this;
        }

        public Builder avgResponseTimeMs(Double avgResponseTimeMs) {
            this.avgResponseTimeMs = avgResponseTimeMs;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public AgentDescriptor build() {
            return new AgentDescriptor(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AgentDescriptor that))
            return false;
        return Objects.equals(agentId, that.agentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentId);
    }

    @Override
    public String toString() {
        return "AgentDescriptor{id='" + agentId + "', health=" + healthStatus
                + ", capabilities=" + capabilities.keySet() + "}";
    }
}
