package agentmesh.coordinator.model;

/**
 * Outcome of a cancel request. Both values acknowledge the request.
 */
public enum CancelResult {
    /** Task moved to CANCELLED by this call */
    CANCELLED,
    /** Task was already COMPLETED, FAILED or CANCELLED; nothing changed */
    ALREADY_TERMINAL
}
