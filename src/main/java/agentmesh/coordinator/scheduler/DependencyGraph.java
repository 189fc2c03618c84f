package agentmesh.coordinator.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Task dependency DAG with both edge directions indexed.
 * Not thread-safe; guarded by the task manager lock.
 */
final class DependencyGraph {

    // task -> tasks it waits for
    private final Map<String, LinkedHashSet<String>> dependencies = new HashMap<>();
    // task -> tasks waiting for it
    private final Map<String, LinkedHashSet<String>> dependents = new HashMap<>();

    /**
     * Add a node with its dependency edges. The caller has already checked
     * {@link #findCycle(String, Iterable)}.
     */
    void add(String taskId, Iterable<String> dependsOn) {
        dependencies.computeIfAbsent(taskId, k -> new LinkedHashSet<>());
        dependents.computeIfAbsent(taskId, k -> new LinkedHashSet<>());
        for (String dep : dependsOn) {
            addEdge(taskId, dep);
        }
    }

    void addEdge(String taskId, String dependsOn) {
        dependencies.computeIfAbsent(taskId, k -> new LinkedHashSet<>()).add(dependsOn);
        dependents.computeIfAbsent(dependsOn, k -> new LinkedHashSet<>()).add(taskId);
    }

    /** @return false if the edge did not exist */
    boolean removeEdge(String taskId, String dependsOn) {
        Set<String> deps = dependencies.get(taskId);
        if (deps == null || !deps.remove(dependsOn)) {
            return false;
        }
        Set<String> waiting = dependents.get(dependsOn);
        if (waiting != null) {
            waiting.remove(taskId);
        }
        return true;
    }

    /**
     * Would giving {@code taskId} these dependencies close a cycle?
     *
     * @return the cycle as a path that starts and ends with {@code taskId},
     *         or an empty list
     */
    List<String> findCycle(String taskId, Iterable<String> dependsOn) {
        for (String dep : dependsOn) {
            if (dep.equals(taskId)) {
                return List.of(taskId, taskId);
            }
            List<String> path = pathTo(dep, taskId);
            if (!path.isEmpty()) {
                List<String> cycle = new ArrayList<>(path.size() + 1);
                cycle.add(taskId);
                cycle.addAll(path);
                return cycle;
            }
        }
        return List.of();
    }

    // DFS along dependency edges from 'from'; the path from 'from' to 'target' inclusive
    private List<String> pathTo(String from, String target) {
        Deque<List<String>> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(List.of(from));
        while (!stack.isEmpty()) {
            List<String> path = stack.pop();
            String node = path.get(path.size() - 1);
            if (node.equals(target)) {
                return path;
            }
            if (!seen.add(node)) {
                continue;
            }
            for (String next : dependenciesOf(node)) {
                if (!seen.contains(next)) {
                    List<String> extended = new ArrayList<>(path);
                    extended.add(next);
                    stack.push(extended);
                }
            }
        }
        return List.of();
    }

    Set<String> dependenciesOf(String taskId) {
        Set<String> deps = dependencies.get(taskId);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    Set<String> dependentsOf(String taskId) {
        Set<String> deps = dependents.get(taskId);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    /**
     * Every task that transitively depends on {@code taskId}, nearest first.
     */
    List<String> transitiveDependents(String taskId) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependentsOf(taskId));
        while (!queue.isEmpty()) {
            String next = queue.pollFirst();
            if (seen.add(next)) {
                result.add(next);
                queue.addAll(dependentsOf(next));
            }
        }
        return result;
    }
}
