package agentmesh.coordinator.invoker;

/**
 * Outcome reported by an agent. A result with {@code success == false} is
 * treated exactly like an exceptionally completed future.
 */
public record InvocationResult(boolean success, String output, String error) {

    public static InvocationResult ok(String output) {
        return new InvocationResult(true, output, null);
    }

    public static InvocationResult failed(String error) {
        return new InvocationResult(false, null, error);
    }
}
