package agentmesh.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a task as seen by callers.
 * The scheduler keeps its own mutable record and hands out copies of this type.
 */
public final class Task {
    private final String id;
    private final String contextId;
    private final String capabilityId;
    private final Priority priority;
    private final List<String> dependencies;
    private final List<String> dependents;
    private final TaskState state;
    private final String payload;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final int retryCount;
    private final int maxRetries;
    private final Duration timeout;
    private final String result;
    private final TaskError error;
    private final String assignedAgent;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.contextId = builder.contextId;
        this.capabilityId = Objects.requireNonNull(builder.capabilityId, "capabilityId is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.dependencies = List.copyOf(builder.dependencies);
        this.dependents = List.copyOf(builder.dependents);
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.payload = builder.payload;
        this.metadata = Map.copyOf(builder.metadata);
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.timeout = builder.timeout;
        this.result = builder.result;
        this.error = builder.error;
        this.assignedAgent = builder.assignedAgent;
    }

    // Getters
    public String id() {
        return id;
    }

    public String contextId() {
        return contextId;
    }

    public String capabilityId() {
        return capabilityId;
    }

    public Priority priority() {
        return priority;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public List<String> dependents() {
        return dependents;
    }

    public TaskState state() {
        return state;
    }

    public String payload() {
        return payload;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration timeout() {
        return timeout;
    }

    public String result() {
        return result;
    }

    public TaskError error() {
        return error;
    }

    public String assignedAgent() {
        return assignedAgent;
    }

    /** Check if task can be retried */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Duration of the last attempt in milliseconds, or null if it never finished */
    public Long executionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .contextId(contextId)
                .capabilityId(capabilityId)
                .priority(priority)
                .dependencies(dependencies)
                .dependents(dependents)
                .state(state)
                .payload(payload)
                .metadata(metadata)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .timeout(timeout)
                .result(result)
                .error(error)
                .assignedAgent(assignedAgent);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String contextId;
        private String capabilityId;
        private Priority priority = Priority.MEDIUM;
        private List<String> dependencies = List.of();
        private List<String> dependents = List.of();
        private TaskState state = TaskState.QUEUED;
        private String payload;
        private Map<String, String> metadata = Map.of();
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private int retryCount = 0;
        private int maxRetries = 3;
        private Duration timeout;
        private String result;
        private TaskError error;
        private String assignedAgent;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder contextId(String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder capabilityId(String capabilityId) {
            this.capabilityId = capabilityId;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies == null ? List.of() : dependencies;
            return this;
        }

        public Builder dependents(List<String> dependents) {
            this.dependents = dependents == null ? List.of() : dependents;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata == null ? Map.of() : metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(TaskError error) {
            this.error = error;
            return this;
        }

        public Builder assignedAgent(String assignedAgent) {
            this.assignedAgent = assignedAgent;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', capability='" + capabilityId + "', state=" + state
                + ", retries=" + retryCount + "/" + maxRetries + "}";
    }
}
