package agentmesh.coordinator.error;

import agentmesh.coordinator.model.Priority;

/**
 * The target priority lane is at capacity; the task was not created.
 */
public class ResourceExhaustedException extends CoordinatorException {

    private final Priority priority;
    private final int capacity;

    public ResourceExhaustedException(Priority priority, int capacity) {
        super("lane " + priority + " is full (capacity " + capacity + ")");
        this.priority = priority;
        this.capacity = capacity;
    }

    public Priority priority() {
        return priority;
    }

    public int capacity() {
        return capacity;
    }
}
