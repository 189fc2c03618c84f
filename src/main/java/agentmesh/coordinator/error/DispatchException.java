package agentmesh.coordinator.error;

import agentmesh.coordinator.model.ErrorKind;

/**
 * The remote invocation reported or threw an error.
 */
public class DispatchException extends TaskExecutionException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DISPATCH;
    }
}
