package com.blueprint.core.breakdown;

import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.DependencyGraph;
import com.blueprint.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 3 of a breakdown: builds the task dependency graph and its critical path.
 * <p>
 * An edge runs from a dependency to the task that depends on it. Cycles are broken by a
 * depth-first walk in task order that drops every edge closing back onto the current
 * walk. The critical path is the source-to-sink path with the largest total estimate;
 * among equal paths the one with the lexicographically smaller ids wins, compared from
 * the first task on.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final double EPSILON = 1e-9;

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    private final BlueprintMetrics metrics;

    public DependencyGraphBuilder(BlueprintMetrics metrics) {
        this.metrics = metrics;
    }

    public DependencyGraph build(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return DependencyGraph.empty();
        }

        int n = tasks.size();
        List<DependencyGraph.Node> nodes = new ArrayList<>(n);
        Map<String, Integer> index = new HashMap<>();
        for (Task task : tasks) {
            index.putIfAbsent(task.id(), nodes.size());
            nodes.add(new DependencyGraph.Node(task.id(), task.title(), task.estimatedHours()));
        }

        List<int[]> edges = new ArrayList<>();
        List<List<Integer>> outgoing = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            outgoing.add(new ArrayList<>());
        }
        Set<Long> seen = new HashSet<>();
        for (int to = 0; to < n; to++) {
            for (String dependency : tasks.get(to).dependencies()) {
                Integer from = index.get(dependency);
                if (from == null || from == to || !seen.add((long) from * n + to)) {
                    continue;
                }
                outgoing.get(from).add(edges.size());
                edges.add(new int[]{from, to});
            }
        }

        boolean[] removed = breakCycles(n, edges, outgoing);
        int removedCount = 0;
        List<DependencyGraph.Edge> kept = new ArrayList<>();
        for (int e = 0; e < edges.size(); e++) {
            if (removed[e]) {
                removedCount++;
                log.warn("Removed dependency {} -> {} to break a cycle",
                        nodes.get(edges.get(e)[0]).id(), nodes.get(edges.get(e)[1]).id());
            } else {
                kept.add(new DependencyGraph.Edge(nodes.get(edges.get(e)[0]).id(), nodes.get(edges.get(e)[1]).id()));
            }
        }
        metrics.recordBrokenCycleEdges(removedCount);

        List<String> criticalPath = criticalPath(nodes, edges, outgoing, removed);
        log.info("Built dependency graph: {} nodes, {} edges, critical path of {} tasks",
                nodes.size(), kept.size(), criticalPath.size());
        return new DependencyGraph(nodes, kept, criticalPath);
    }

    private static boolean[] breakCycles(int n, List<int[]> edges, List<List<Integer>> outgoing) {
        boolean[] removed = new boolean[edges.size()];
        int[] state = new int[n];
        int[] cursor = new int[n];
        Deque<Integer> stack = new ArrayDeque<>();

        for (int start = 0; start < n; start++) {
            if (state[start] != WHITE) {
                continue;
            }
            state[start] = GRAY;
            stack.push(start);
            while (!stack.isEmpty()) {
                int node = stack.peek();
                List<Integer> out = outgoing.get(node);
                if (cursor[node] < out.size()) {
                    int edge = out.get(cursor[node]++);
                    int target = edges.get(edge)[1];
                    if (state[target] == GRAY) {
                        removed[edge] = true;
                    } else if (state[target] == WHITE) {
                        state[target] = GRAY;
                        stack.push(target);
                    }
                } else {
                    state[node] = BLACK;
                    stack.pop();
                }
            }
        }
        return removed;
    }

    private static List<String> criticalPath(List<DependencyGraph.Node> nodes, List<int[]> edges,
                                             List<List<Integer>> outgoing, boolean[] removed) {
        int n = nodes.size();
        int[] inDegree = new int[n];
        for (int e = 0; e < edges.size(); e++) {
            if (!removed[e]) {
                inDegree[edges.get(e)[1]]++;
            }
        }

        // Kahn's algorithm; the graph is acyclic so every node is ordered.
        int[] remaining = inDegree.clone();
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (remaining[i] == 0) {
                ready.add(i);
            }
        }
        List<Integer> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int node = ready.poll();
            order.add(node);
            for (int edge : outgoing.get(node)) {
                if (!removed[edge] && --remaining[edges.get(edge)[1]] == 0) {
                    ready.add(edges.get(edge)[1]);
                }
            }
        }

        double[] best = new double[n];
        int[] next = new int[n];
        for (int k = order.size() - 1; k >= 0; k--) {
            int node = order.get(k);
            next[node] = -1;
            double tail = 0;
            for (int edge : outgoing.get(node)) {
                if (removed[edge]) {
                    continue;
                }
                int successor = edges.get(edge)[1];
                if (next[node] < 0 || isBetter(best[successor], successor, tail, next[node], nodes)) {
                    tail = best[successor];
                    next[node] = successor;
                }
            }
            best[node] = nodes.get(node).estimatedHours() + tail;
        }

        int start = -1;
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0 && (start < 0 || isBetter(best[i], i, best[start], start, nodes))) {
                start = i;
            }
        }

        List<String> path = new ArrayList<>();
        for (int node = start; node >= 0; node = next[node]) {
            path.add(nodes.get(node).id());
        }
        return List.copyOf(path);
    }

    private static boolean isBetter(double candidateHours, int candidate, double currentHours, int current,
                                    List<DependencyGraph.Node> nodes) {
        if (candidateHours > currentHours + EPSILON) {
            return true;
        }
        if (candidateHours < currentHours - EPSILON) {
            return false;
        }
        return nodes.get(candidate).id().compareTo(nodes.get(current).id()) < 0;
    }
}
