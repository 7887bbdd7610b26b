package dev.depgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;

import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;

/**
 * Assigns the advisory {@code layer} attribute: BFS distance from the root nodes (nodes nothing
 * depends on). Nodes only reachable through a cycle with no root get seeded at layer 0.
 */
public final class LayerAssigner {

    private LayerAssigner() {
    }

    public static Graph assign(Graph graph) {
        final Map<String, List<String>> out = new HashMap<>();
        final Set<String> hasIncoming = new HashSet<>();
        for (Edge e : graph.edges()) {
            if (!graph.contains(e.from()) || !graph.contains(e.to())) {
                continue;
            }
            out.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e.to());
            hasIncoming.add(e.to());
        }

        final Map<String, Integer> layers = new HashMap<>();
        final List<String> roots = new ArrayList<>();
        for (String id : graph.nodes().keySet()) {
            if (!hasIncoming.contains(id)) {
                roots.add(id);
            }
        }
        bfs(roots, out, layers);

        // cycle-only islands
        for (String id : graph.nodes().keySet()) {
            if (!layers.containsKey(id)) {
                bfs(List.of(id), out, layers);
            }
        }

        final Map<String, GraphNode> nodes = new TreeMap<>();
        for (GraphNode n : graph.nodes().values()) {
            nodes.put(n.id(), n.withLayer(layers.getOrDefault(n.id(), 0)));
        }
        return new Graph(nodes, graph.edges(), graph.options());
    }

    private static void bfs(List<String> seeds, Map<String, List<String>> out, Map<String, Integer> layers) {
        final Queue<String> queue = new ArrayDeque<>();
        for (String s : seeds) {
            if (!layers.containsKey(s)) {
                layers.put(s, 0);
                queue.add(s);
            }
        }
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            final int next = layers.get(current) + 1;
            for (String dep : out.getOrDefault(current, List.of())) {
                if (!layers.containsKey(dep)) {
                    layers.put(dep, next);
                    queue.add(dep);
                }
            }
        }
    }
}
