package ai.yarrow.analysis.graph;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dependency graph of an analysis. Edges go from an argument to the component consuming it.
 */
public class DirectedGraph {
    private final Map<Integer, Set<Edge>> graph = new HashMap<>();  // vertex id -> outgoing edges
    private final Map<Integer, Set<Edge>> reversedGraph = new HashMap<>();  // vertex id -> incoming edges
    private final Set<Vertex> vertexes = new LinkedHashSet<>();

    public record Vertex(int id, String label) {}

    public record Edge(Vertex input, Vertex output, String argument) {}

    public Set<Edge> children(int parent) {
        return graph.getOrDefault(parent, new HashSet<>());
    }

    public Set<Edge> parents(int child) {
        return reversedGraph.getOrDefault(child, new HashSet<>());
    }

    public void addEdges(Collection<Edge> edges) {
        edges.forEach(this::addEdge);
    }

    public void addEdge(Edge edge) {
        vertexes.add(edge.input());
        vertexes.add(edge.output());
        graph
            .computeIfAbsent(edge.input().id(), k -> new HashSet<>())
            .add(edge);
        reversedGraph
            .computeIfAbsent(edge.output().id(), k -> new HashSet<>())
            .add(edge);
    }

    public void addVertex(Vertex vertex) {
        vertexes.add(vertex);
    }

    public Set<Vertex> vertexes() {
        return vertexes;
    }

    public Set<Edge> edges() {
        return graph.values().stream()
            .flatMap(Set::stream)
            .collect(Collectors.toSet());
    }

    /** Vertexes without arguments. */
    public Set<Vertex> sources() {
        return vertexes.stream()
            .filter(v -> parents(v.id()).isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
