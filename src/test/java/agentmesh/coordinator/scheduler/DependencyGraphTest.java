package agentmesh.coordinator.scheduler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void indexesBothDirections() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("a", List.of());
        graph.add("b", List.of("a"));
        graph.add("c", List.of("a", "b"));

        assertEquals(Set.of("a", "b"), graph.dependenciesOf("c"));
        assertEquals(Set.of("b", "c"), graph.dependentsOf("a"));
        assertTrue(graph.dependenciesOf("missing").isEmpty());
    }

    @Test
    void removeEdgeDropsBothDirections() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("a", List.of());
        graph.add("b", List.of());
        graph.add("c", List.of("a", "b"));

        assertTrue(graph.removeEdge("c", "a"));
        assertFalse(graph.removeEdge("c", "a"));
        assertFalse(graph.removeEdge("missing", "a"));

        assertEquals(Set.of("b"), graph.dependenciesOf("c"));
        assertTrue(graph.dependentsOf("a").isEmpty());
        // the removed edge no longer counts towards a cycle
        assertTrue(graph.findCycle("a", List.of("c")).isEmpty());
    }

    @Test
    void selfDependencyIsACycle() {
        DependencyGraph graph = new DependencyGraph();

        assertEquals(List.of("t", "t"), graph.findCycle("t", List.of("t")));
    }

    @Test
    void findsCycleThroughExistingEdges() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("a", List.of());
        graph.add("b", List.of("a"));
        graph.add("c", List.of("b"));

        // a -> c would close a -> c -> b -> a
        assertEquals(List.of("a", "c", "b", "a"), graph.findCycle("a", List.of("c")));
        assertTrue(graph.findCycle("d", List.of("c")).isEmpty());
        assertTrue(graph.findCycle("c", List.of("a")).isEmpty());
    }

    @Test
    void transitiveDependentsNearestFirst() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("root", List.of());
        graph.add("child", List.of("root"));
        graph.add("grandchild", List.of("child"));
        graph.add("other", List.of());

        assertEquals(List.of("child", "grandchild"), graph.transitiveDependents("root"));
        assertTrue(graph.transitiveDependents("other").isEmpty());
    }

    @Test
    void diamondDependentsListedOnce() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("a", List.of());
        graph.add("b", List.of("a"));
        graph.add("c", List.of("a"));
        graph.add("d", List.of("b", "c"));

        List<String> dependents = graph.transitiveDependents("a");

        assertEquals(3, dependents.size());
        assertEquals("d", dependents.get(2));
    }
}
