package agentmesh.coordinator.error;

import agentmesh.coordinator.model.ErrorKind;

/**
 * Recorded on a task whose dependency failed or was cancelled before it could
 * run. Never retried.
 */
public class DependencyFailedException extends TaskExecutionException {

    private final String sourceTaskId;

    public DependencyFailedException(String sourceTaskId) {
        super("dependency_failed: " + sourceTaskId);
        this.sourceTaskId = sourceTaskId;
    }

    public String sourceTaskId() {
        return sourceTaskId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DEPENDENCY_FAILED;
    }
}
