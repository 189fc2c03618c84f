package agentmesh.coordinator.scheduler;

import agentmesh.coordinator.model.Priority;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;

/**
 * One FIFO of task ids per priority. Not thread-safe; the task manager
 * guards it with its own lock.
 */
final class PriorityLanes {

    private final Map<Priority, ArrayDeque<String>> lanes = new EnumMap<>(Priority.class);
    private final int capacity;

    PriorityLanes(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("lane capacity must be positive");
        }
        this.capacity = capacity;
        for (Priority p : Priority.values()) {
            lanes.put(p, new ArrayDeque<>());
        }
    }

    boolean hasCapacity(Priority priority) {
        return lanes.get(priority).size() < capacity;
    }

    /** Append to the lane tail. Capacity is checked by the caller, at admission only. */
    void offer(Priority priority, String taskId) {
        lanes.get(priority).addLast(taskId);
    }

    /** Head of the first non-empty lane, URGENT first; null when all are empty */
    String poll() {
        for (Priority p : Priority.values()) {
            String head = lanes.get(p).pollFirst();
            if (head != null) {
                return head;
            }
        }
        return null;
    }

    boolean remove(Priority priority, String taskId) {
        return lanes.get(priority).remove(taskId);
    }

    Map<Priority, Integer> depths() {
        Map<Priority, Integer> result = new EnumMap<>(Priority.class);
        lanes.forEach((p, q) -> result.put(p, q.size()));
        return result;
    }

    int capacity() {
        return capacity;
    }
}
