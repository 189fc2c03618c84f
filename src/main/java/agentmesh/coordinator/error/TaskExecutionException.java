package agentmesh.coordinator.error;

import agentmesh.coordinator.model.ErrorKind;
import agentmesh.coordinator.model.TaskError;

/**
 * Execution-class failure of a single attempt. These never reach the caller of
 * createTask; the retry policy absorbs them and the last one is recorded on
 * the task as a {@link TaskError}.
 */
public abstract class TaskExecutionException extends CoordinatorException {

    protected TaskExecutionException(String message) {
        super(message);
    }

    protected TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public TaskError toTaskError() {
        return new TaskError(kind(), getMessage());
    }
}
