package agentmesh.coordinator.error;

/**
 * Malformed arguments to a coordinator operation. Nothing was changed.
 * Extends {@link IllegalArgumentException} so the HTTP layer answers 400.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
