package ai.pyflow.graph;

import java.util.List;

import ai.pyflow.model.ParseWarning;

/**
 * Fully assembled graph, ready for rendering.
 * - nodes: one per analyzed file, in discovery order
 * - edges: imports first, then calls (calls in sequence order for the sequenced variant)
 */
public record Graph(
        List<Node> nodes,
        List<Edge> edges,
        boolean sequenced,
        int droppedImports,
        List<ParseWarning> parseWarnings
) {
    public Graph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        parseWarnings = List.copyOf(parseWarnings);
    }

    public record Node(
            String id,      // absolute path
            String label
    ) {
    }

    public record Edge(
            String from,
            String to,
            EdgeKind kind,
            String label,   // "imports" | "calls" | "call <n>"
            String color,
            Integer sequence // null unless sequenced call edge
    ) {
    }

    public List<Edge> edges(EdgeKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).toList();
    }
}
