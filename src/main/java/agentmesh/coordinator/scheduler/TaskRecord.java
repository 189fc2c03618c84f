package agentmesh.coordinator.scheduler;

import agentmesh.coordinator.invoker.InvocationResult;
import agentmesh.coordinator.model.Priority;
import agentmesh.coordinator.model.RoutingPreferences;
import agentmesh.coordinator.model.Task;
import agentmesh.coordinator.model.TaskError;
import agentmesh.coordinator.model.TaskState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable scheduler-side state of one task. Only touched under the task
 * manager lock; callers get {@link Task} snapshots.
 */
final class TaskRecord {

    final String id;
    final String contextId;
    final String capabilityId;
    final Priority priority;
    final List<String> dependencies;
    final String payload;
    final Map<String, String> metadata;
    final RoutingPreferences routing;
    final Instant createdAt;
    final int maxRetries;
    final Duration timeout;

    TaskState state;
    Instant firstQueuedAt;
    Instant startedAt;
    Instant completedAt;
    int retryCount;
    String result;
    TaskError error;
    String assignedAgent;

    // bumped on every dispatch; callbacks carrying an older value are stale
    long attempt;
    boolean everDispatched;
    boolean inLane;

    CompletableFuture<InvocationResult> inFlight;
    ScheduledFuture<?> timeoutTimer;
    ScheduledFuture<?> retryTimer;

    TaskRecord(String id, String contextId, String capabilityId, Priority priority, List<String> dependencies,
            String payload, Map<String, String> metadata, RoutingPreferences routing, Instant createdAt, int maxRetries,
            Duration timeout) {
        this.id = id;
        this.contextId = contextId;
        this.capabilityId = capabilityId;
        this.priority = priority;
        this.dependencies = new ArrayList<>(dependencies);
        this.payload = payload;
        this.metadata = Map.copyOf(metadata);
        this.routing = routing;
        this.createdAt = createdAt;
        this.maxRetries = maxRetries;
        this.timeout = timeout;
    }

    boolean isTerminal() {
        return state.isTerminal();
    }

    boolean canRetry() {
        return retryCount < maxRetries;
    }

    Task toSnapshot(List<String> dependents) {
        return Task.builder()
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
                .assignedAgent(assignedAgent)
                .build();
    }

    @Override
    public String toString() {
        return "TaskRecord{id='" + id + "', state=" + state + ", attempt=" + attempt + "}";
    }
}
