package agentmesh.coordinator.model;

/**
 * Classification of the error recorded on a task.
 */
public enum ErrorKind {
    /** No live agent declared the requested capability */
    NO_AGENT(true),
    /** The remote invocation failed */
    DISPATCH(true),
    /** The invocation did not finish within the task timeout */
    TIMEOUT(true),
    /** A (transitive) dependency failed permanently */
    DEPENDENCY_FAILED(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
