package ai.pyflow.io;

import java.util.Objects;

import ai.pyflow.graph.Graph;

/**
 * Graphviz DOT text for a {@link Graph}. Fixed default styling:
 * left-to-right layout, filled light-yellow boxes in Courier, small arrow heads.
 */
public final class DotWriter {

    private final String graphName;

    public DotWriter(String graphName) {
        this.graphName = Objects.requireNonNull(graphName, "graphName");
    }

    public String toDot(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(graphName)).append(" {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [style=filled, shape=box, fillcolor=lightyellow, fontname=Courier];\n");
        sb.append("  edge [arrowsize=0.7];\n");

        for (Graph.Node node : graph.nodes()) {
            sb.append("  ").append(quote(node.id()))
                    .append(" [label=").append(quote(node.label())).append("];\n");
        }
        for (Graph.Edge edge : graph.edges()) {
            sb.append("  ").append(quote(edge.from())).append(" -> ").append(quote(edge.to()))
                    .append(" [label=").append(quote(edge.label()))
                    .append(", color=").append(edge.color()).append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String quote(String raw) {
        final StringBuilder sb = new StringBuilder(raw.length() + 2);
        sb.append('"');
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> {
                }
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
