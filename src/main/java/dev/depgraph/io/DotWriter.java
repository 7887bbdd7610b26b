package dev.depgraph.io;

import java.util.Objects;

import dev.depgraph.graph.Graph;
import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;

/**
 * Renders a graph in the DOT graph-description language.
 * Containers are filled light blue, sub-targets light green, transient nodes dashed.
 */
public final class DotWriter {

    private DotWriter() {
    }

    public static String render(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph DependencyGraph {\n");
        sb.append("  rankdir=TB;\n");
        sb.append("  node [shape=box, style=rounded];\n\n");

        for (GraphNode n : graph.nodes().values()) {
            sb.append("  ").append(quote(n.id()))
                    .append(" [label=").append(quote(n.name()))
                    .append(attributes(n))
                    .append("];\n");
        }
        sb.append('\n');
        for (Edge e : graph.edges()) {
            // filtered views may leave edges behind
            if (!graph.contains(e.from()) || !graph.contains(e.to())) {
                continue;
            }
            sb.append("  ").append(quote(e.from())).append(" -> ").append(quote(e.to())).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String attributes(GraphNode n) {
        final String style = n.isTransient() ? "rounded,dashed" : "rounded";
        return switch (n.kind()) {
            case CONTAINER -> ", style=\"" + style + ",filled\", fillcolor=\"lightblue\"";
            case SUB_TARGET -> ", style=\"" + style + ",filled\", fillcolor=\"lightgreen\"";
            case INTERNAL_MODULE -> ", style=\"" + style + ",filled\", fillcolor=\"lightyellow\"";
            case EXTERNAL_MODULE -> ", style=\"" + style + "\"";
        };
    }

    static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
