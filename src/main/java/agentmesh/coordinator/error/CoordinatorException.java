package agentmesh.coordinator.error;

/**
 * Base class for coordinator failures other than argument validation.
 */
public class CoordinatorException extends RuntimeException {

    public CoordinatorException(String message) {
        super(message);
    }

    public CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
