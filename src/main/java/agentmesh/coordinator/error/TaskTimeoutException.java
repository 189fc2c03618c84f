package agentmesh.coordinator.error;

import agentmesh.coordinator.model.ErrorKind;

import java.time.Duration;

public class TaskTimeoutException extends TaskExecutionException {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("task " + taskId + " timed out after " + timeout.toMillis() + "ms");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
