package agentmesh.coordinator.model;

/**
 * Task lifecycle state.
 */
public enum TaskState {
    /** All dependencies completed, waiting in a lane (or for a retry delay) */
    QUEUED,
    /** Waiting for at least one dependency to complete */
    BLOCKED,
    /** Dispatched to an agent */
    RUNNING,
    /** Completed successfully */
    COMPLETED,
    /** Failed permanently (retries exhausted or a dependency failed) */
    FAILED,
    /** Cancelled by a caller or by a cancelled dependency */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
