package com.blueprint.core.breakdown;

import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.DependencyGraph;
import com.blueprint.core.model.Task;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.blueprint.core.breakdown.BreakdownFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private SimpleMeterRegistry registry;
    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        builder = new DependencyGraphBuilder(new BlueprintMetrics(registry));
    }

    @Test
    @DisplayName("empty input yields an empty graph and critical path")
    void empty() {
        DependencyGraph graph = builder.build(List.of());

        assertTrue(graph.nodes().isEmpty());
        assertTrue(graph.edges().isEmpty());
        assertTrue(graph.criticalPath().isEmpty());
    }

    @Test
    @DisplayName("nodes follow task order and edges run from dependency to dependent")
    void nodesAndEdges() {
        DependencyGraph graph = builder.build(List.of(task("t_1", 8), task("t_2", 4, "t_1")));

        assertEquals(List.of("t_1", "t_2"), graph.nodes().stream().map(DependencyGraph.Node::id).toList());
        assertEquals(List.of(new DependencyGraph.Edge("t_1", "t_2")), graph.edges());
        assertEquals(8.0, graph.nodes().get(0).estimatedHours());
    }

    @Test
    @DisplayName("a single task is its own critical path")
    void singleTask() {
        assertEquals(List.of("t_1"), builder.build(List.of(task("t_1", 3))).criticalPath());
    }

    @Nested
    @DisplayName("critical path")
    class CriticalPath {

        @Test
        @DisplayName("follows the heaviest chain, not the longest one")
        void heaviestChain() {
            // t_1 -> t_2 -> t_3 totals 6h; t_4 -> t_5 totals 20h
            DependencyGraph graph = builder.build(List.of(
                    task("t_1", 2), task("t_2", 2, "t_1"), task("t_3", 2, "t_2"),
                    task("t_4", 10), task("t_5", 10, "t_4")));

            assertEquals(List.of("t_4", "t_5"), graph.criticalPath());
        }

        @Test
        @DisplayName("ties go to the smaller start id")
        void tieOnStart() {
            DependencyGraph graph = builder.build(List.of(task("t_2", 5), task("t_1", 5)));

            assertEquals(List.of("t_1"), graph.criticalPath());
        }

        @Test
        @DisplayName("ties further down go to the smaller successor id")
        void tieOnSuccessor() {
            DependencyGraph graph = builder.build(List.of(
                    task("t_1", 4), task("t_3", 3, "t_1"), task("t_2", 3, "t_1")));

            assertEquals(List.of("t_1", "t_2"), graph.criticalPath());
        }

        @Test
        @DisplayName("joins branches through a shared sink")
        void diamond() {
            DependencyGraph graph = builder.build(List.of(
                    task("t_1", 1), task("t_2", 5, "t_1"), task("t_3", 2, "t_1"), task("t_4", 1, "t_2", "t_3")));

            assertEquals(List.of("t_1", "t_2", "t_4"), graph.criticalPath());
        }
    }

    @Nested
    @DisplayName("cycle breaking")
    class Cycles {

        @Test
        @DisplayName("removes the edge closing a three-task cycle")
        void threeCycle() {
            DependencyGraph graph = builder.build(List.of(
                    task("t_1", 1, "t_3"), task("t_2", 1, "t_1"), task("t_3", 1, "t_2")));

            assertEquals(List.of(new DependencyGraph.Edge("t_1", "t_2"), new DependencyGraph.Edge("t_2", "t_3")),
                    graph.edges());
            assertEquals(List.of("t_1", "t_2", "t_3"), graph.criticalPath());
            assertEquals(1.0, registry.find("blueprint.graph.broken_cycle_edges").counter().count());
        }

        @Test
        @DisplayName("removes one edge of a two-task cycle")
        void mutualDependency() {
            DependencyGraph graph = builder.build(List.of(task("t_1", 1, "t_2"), task("t_2", 1, "t_1")));

            assertEquals(1, graph.edges().size());
            assertAcyclic(graph);
        }

        @Test
        @DisplayName("ignores self and unknown references")
        void selfAndUnknown() {
            DependencyGraph graph = builder.build(List.of(task("t_1", 1, "t_1", "t_9")));

            assertTrue(graph.edges().isEmpty());
            assertNull(registry.find("blueprint.graph.broken_cycle_edges").counter());
        }
    }

    @Test
    @DisplayName("random graphs come out acyclic with a maximal critical path")
    void randomizedMaximality() {
        Random random = new Random(7);
        for (int round = 0; round < 150; round++) {
            int n = 1 + random.nextInt(9);
            List<Task> tasks = new ArrayList<>();
            for (int i = 1; i <= n; i++) {
                List<String> deps = new ArrayList<>();
                for (int j = 1; j <= n; j++) {
                    if (j != i && random.nextInt(4) == 0) {
                        deps.add("t_" + j);
                    }
                }
                tasks.add(task("t_" + i, random.nextInt(4) * 2.5, deps.toArray(String[]::new)));
            }

            DependencyGraph graph = builder.build(tasks);
            assertAcyclic(graph);

            Map<String, Double> hours = new HashMap<>();
            graph.nodes().forEach(node -> hours.put(node.id(), node.estimatedHours()));
            Map<String, List<String>> successors = successors(graph);
            Set<String> targets = new HashSet<>();
            graph.edges().forEach(e -> targets.add(e.to()));

            List<String> path = graph.criticalPath();
            assertFalse(path.isEmpty());
            assertFalse(targets.contains(path.get(0)), "critical path must start at a source");
            assertTrue(successors.get(path.get(path.size() - 1)).isEmpty(), "critical path must end at a sink");
            for (int k = 0; k + 1 < path.size(); k++) {
                assertTrue(successors.get(path.get(k)).contains(path.get(k + 1)));
            }

            double best = 0;
            for (var node : graph.nodes()) {
                if (!targets.contains(node.id())) {
                    best = Math.max(best, heaviest(node.id(), successors, hours));
                }
            }
            double actual = path.stream().mapToDouble(hours::get).sum();
            assertEquals(best, actual, 1e-9);
        }
    }

    private static double heaviest(String node, Map<String, List<String>> successors, Map<String, Double> hours) {
        double tail = 0;
        for (String next : successors.get(node)) {
            tail = Math.max(tail, heaviest(next, successors, hours));
        }
        return hours.get(node) + tail;
    }

    private static Map<String, List<String>> successors(DependencyGraph graph) {
        Map<String, List<String>> successors = new HashMap<>();
        graph.nodes().forEach(node -> successors.put(node.id(), new ArrayList<>()));
        graph.edges().forEach(e -> successors.get(e.from()).add(e.to()));
        return successors;
    }

    private static void assertAcyclic(DependencyGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        graph.nodes().forEach(node -> inDegree.put(node.id(), 0));
        graph.edges().forEach(e -> inDegree.merge(e.to(), 1, Integer::sum));
        Map<String, List<String>> successors = successors(graph);

        List<String> ready = new ArrayList<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            String node = ready.remove(ready.size() - 1);
            visited++;
            for (String next : successors.get(node)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        assertEquals(graph.nodes().size(), visited, "graph contains a cycle");
    }
}
