package dev.depgraph.model;

import java.util.Objects;

/**
 * Immutable node value. Merging goes through {@link #mergedWith(GraphNode)}.
 */
public record GraphNode(
        String id,
        String name,        // display name, case preserved
        NodeKind kind,
        boolean isTransient,
        int layer           // BFS distance from a root; rendering only
) {
    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static GraphNode of(String id, String name, NodeKind kind, boolean isTransient) {
        return new GraphNode(id, name, kind, isTransient, 0);
    }

    /**
     * Combines two observations of the same id: kind follows the upgrade table, a node stays
     * explicit once any observation is explicit, and the smallest display spelling wins.
     */
    public GraphNode mergedWith(GraphNode other) {
        if (!id.equals(other.id)) {
            throw new IllegalArgumentException("cannot merge " + id + " with " + other.id);
        }
        final String mergedName = name.compareTo(other.name) <= 0 ? name : other.name;
        return new GraphNode(id, mergedName, kind.merge(other.kind),
                isTransient && other.isTransient, Math.min(layer, other.layer));
    }

    public GraphNode withLayer(int newLayer) {
        return new GraphNode(id, name, kind, isTransient, newLayer);
    }
}
