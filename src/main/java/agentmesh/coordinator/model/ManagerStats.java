package agentmesh.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Point-in-time task manager counters.
 *
 * @param meanQueuedToCompletedMs mean time from first entering QUEUED to
 *                                COMPLETED, or null before any completion
 * @param retryRate               tasks retried at least once divided by all
 *                                tasks, 0 when there are none
 */
public record ManagerStats(
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("tasksByState") Map<TaskState, Integer> tasksByState,
        @JsonProperty("tasksByPriority") Map<Priority, Integer> tasksByPriority,
        @JsonProperty("laneDepths") Map<Priority, Integer> laneDepths,
        @JsonProperty("runningTasks") int runningTasks,
        @JsonProperty("maxConcurrentTasks") int maxConcurrentTasks,
        @JsonProperty("meanQueuedToCompletedMs") Double meanQueuedToCompletedMs,
        @JsonProperty("retryRate") double retryRate) {

    public int count(TaskState state) {
        return tasksByState.getOrDefault(state, 0);
    }
}
