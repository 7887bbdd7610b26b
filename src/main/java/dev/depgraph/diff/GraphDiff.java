package dev.depgraph.diff;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set differences between two graph snapshots. Nodes are ids, edges are {@code from->to} keys.
 */
public record GraphDiff(
        Set<String> addedNodes,
        Set<String> removedNodes,
        Set<String> addedEdges,
        Set<String> removedEdges
) {
    public GraphDiff {
        addedNodes = sorted(addedNodes);
        removedNodes = sorted(removedNodes);
        addedEdges = sorted(addedEdges);
        removedEdges = sorted(removedEdges);
    }

    public boolean isEmpty() {
        return addedNodes.isEmpty() && removedNodes.isEmpty() && addedEdges.isEmpty() && removedEdges.isEmpty();
    }

    public GraphDiff reversed() {
        return new GraphDiff(removedNodes, addedNodes, removedEdges, addedEdges);
    }

    private static Set<String> sorted(Set<String> in) {
        return Collections.unmodifiableSet(new TreeSet<>(in));
    }
}
