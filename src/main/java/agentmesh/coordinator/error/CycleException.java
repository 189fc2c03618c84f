package agentmesh.coordinator.error;

import java.util.List;

/**
 * A submission or dependency edge would close a cycle in the dependency graph.
 * The graph and the task table are left untouched.
 */
public class CycleException extends CoordinatorException {

    private final List<String> path;

    public CycleException(List<String> path) {
        super("dependency cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /** The offending cycle, starting and ending with the same task id */
    public List<String> path() {
        return path;
    }
}
