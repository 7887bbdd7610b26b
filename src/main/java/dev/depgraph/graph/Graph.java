package dev.depgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;
import dev.depgraph.model.IdScheme;

/**
 * Finished, immutable dependency graph.
 * - nodes keyed by id (sorted)
 * - edges sorted by (from, to), no multi-edges
 * - the options and id scheme it was built with, so writers can stamp the schema version
 */
public record Graph(
        Map<String, GraphNode> nodes,
        Set<Edge> edges,
        BuildOptions options
) {
    public Graph {
        nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
        final TreeSet<Edge> sorted = new TreeSet<>(Edge.ORDER);
        sorted.addAll(edges);
        edges = Collections.unmodifiableSet(sorted);
    }

    public static Graph empty(BuildOptions options) {
        return new Graph(Map.of(), Set.of(), options);
    }

    public IdScheme idScheme() {
        return options.stableIds() ? IdScheme.STABLE : IdScheme.LEGACY;
    }

    public String schemaVersion() {
        return idScheme().schemaVersion();
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public List<String> dependencies(String id) {
        final List<String> out = new ArrayList<>();
        for (Edge e : edges) {
            if (e.from().equals(id) && nodes.containsKey(e.to())) {
                out.add(e.to());
            }
        }
        return out;
    }

    public List<String> dependents(String id) {
        final List<String> out = new ArrayList<>();
        for (Edge e : edges) {
            if (e.to().equals(id) && nodes.containsKey(e.from())) {
                out.add(e.from());
            }
        }
        return out;
    }

    public Set<String> edgeKeys() {
        final Set<String> keys = new TreeSet<>();
        for (Edge e : edges) {
            keys.add(e.key());
        }
        return keys;
    }

    /**
     * View without transient nodes. Edges that lose an endpoint are dropped as well.
     */
    public Graph withoutTransient() {
        final Map<String, GraphNode> kept = new TreeMap<>();
        for (GraphNode n : nodes.values()) {
            if (!n.isTransient()) {
                kept.put(n.id(), n);
            }
        }
        final Set<Edge> keptEdges = new TreeSet<>(Edge.ORDER);
        for (Edge e : edges) {
            if (kept.containsKey(e.from()) && kept.containsKey(e.to())) {
                keptEdges.add(e);
            }
        }
        return new Graph(kept, keptEdges, options);
    }
}
