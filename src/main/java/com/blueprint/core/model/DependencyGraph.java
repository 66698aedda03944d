package com.blueprint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Directed acyclic graph of ordering constraints between tasks.
 *
 * @param nodes        one node per task, in task order
 * @param edges        {@code from} must complete before {@code to}
 * @param criticalPath task ids along the longest path by cumulative estimated hours
 */
public record DependencyGraph(
    List<Node> nodes,
    List<Edge> edges,
    List<String> criticalPath
) implements Serializable {

    public DependencyGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        criticalPath = criticalPath != null ? List.copyOf(criticalPath) : List.of();
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(), List.of(), List.of());
    }

    public record Node(String id, String title, double estimatedHours) implements Serializable {}

    public record Edge(String from, String to) implements Serializable {}
}
