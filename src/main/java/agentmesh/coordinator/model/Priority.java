package agentmesh.coordinator.model;

/**
 * Task priority. Declaration order is dispatch order: lanes are drained
 * URGENT first, LOW last.
 */
public enum Priority {
    /** Dispatched before anything else */
    URGENT,
    HIGH,
    MEDIUM,
    /** Dispatched only when every other lane is empty */
    LOW
}
