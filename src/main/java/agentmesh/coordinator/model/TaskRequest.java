package agentmesh.coordinator.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arguments of a task submission. Timeout and retry limit fall back to the
 * coordinator defaults when left null.
 *
 * Nothing is validated here; null dependency ids or metadata entries are
 * kept so the task manager can reject them.
 */
public final class TaskRequest {
    private final String taskId;
    private final String capabilityId;
    private final String contextId;
    private final Priority priority;
    private final Set<String> dependencies;
    private final Duration timeout;
    private final Integer maxRetries;
    private final String payload;
    private final Map<String, String> metadata;
    private final RoutingPreferences routing;

    private TaskRequest(Builder builder) {
        this.taskId = builder.taskId;
        this.capabilityId = builder.capabilityId;
        this.contextId = builder.contextId;
        this.priority = builder.priority;
        this.dependencies = new LinkedHashSet<>(builder.dependencies);
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.payload = builder.payload;
        this.metadata = new LinkedHashMap<>(builder.metadata);
        this.routing = builder.routing == null ? RoutingPreferences.NONE : builder.routing;
    }

    /** Caller-supplied id, or null to have one generated */
    public String taskId() {
        return taskId;
    }

    public String capabilityId() {
        return capabilityId;
    }

    public String contextId() {
        return contextId;
    }

    public Priority priority() {
        return priority;
    }

    public Set<String> dependencies() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    /** Dependencies in submission order */
    public List<String> dependencyList() {
        return Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    public Duration timeout() {
        return timeout;
    }

    public Integer maxRetries() {
        return maxRetries;
    }

    public String payload() {
        return payload;
    }

    public Map<String, String> metadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public RoutingPreferences routing() {
        return routing;
    }

    public static Builder builder(String capabilityId, String contextId, Priority priority) {
        return new Builder().capabilityId(capabilityId).contextId(contextId).priority(priority);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String capabilityId;
        private String contextId;
        private Priority priority = Priority.MEDIUM;
        private Set<String> dependencies = new LinkedHashSet<>();
        private Duration timeout;
        private Integer maxRetries;
        private String payload;
        private Map<String, String> metadata = new LinkedHashMap<>();
        private RoutingPreferences routing;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder capabilityId(String capabilityId) {
            this.capabilityId = capabilityId;
            return this;
        }

        public Builder contextId(String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            this.dependencies.addAll(Arrays.asList(taskIds));
            return this;
        }

        public Builder dependencies(Iterable<String> taskIds) {
            this.dependencies = new LinkedHashSet<>();
            if (taskIds != null) {
                taskIds.forEach(this.dependencies::add);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder routing(RoutingPreferences routing) {
            this.routing = routing;
            return this;
        }

        public TaskRequest build() {
            return new TaskRequest(this);
        }
    }
}
