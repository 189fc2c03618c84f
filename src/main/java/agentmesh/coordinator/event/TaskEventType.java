package agentmesh.coordinator.event;

public enum TaskEventType {
    /** Current state delivered to a new status subscriber */
    SNAPSHOT,
    CREATED,
    QUEUED,
    BLOCKED,
    STARTED,
    RETRY_SCHEDULED,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** A stale completion, failure or timeout was discarded */
    ANOMALY
}
