package dev.depgraph.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;

public record GraphStats(
        int containers,
        int subTargets,
        int internalModules,
        int externalModules,
        int transientNodes,
        int sharedDependencies,   // nodes with more than one dependent
        int edges
) {

    public static GraphStats of(Graph graph) {
        int containers = 0;
        int subTargets = 0;
        int internal = 0;
        int external = 0;
        int transientCount = 0;
        for (GraphNode n : graph.nodes().values()) {
            switch (n.kind()) {
                case CONTAINER -> containers++;
                case SUB_TARGET -> subTargets++;
                case INTERNAL_MODULE -> internal++;
                case EXTERNAL_MODULE -> external++;
            }
            if (n.isTransient()) {
                transientCount++;
            }
        }

        final int shared = consumersOfShared(graph).size();
        return new GraphStats(containers, subTargets, internal, external, transientCount, shared,
                graph.edges().size());
    }

    /**
     * Every node with more than one direct dependent, mapped to those dependents. Keys and
     * consumer lists are sorted.
     */
    public static Map<String, List<String>> consumersOfShared(Graph graph) {
        final Map<String, List<String>> consumers = new TreeMap<>();
        for (Edge e : graph.edges()) {
            if (graph.contains(e.from()) && graph.contains(e.to())) {
                consumers.computeIfAbsent(e.to(), k -> new ArrayList<>()).add(e.from());
            }
        }
        final Map<String, List<String>> shared = new TreeMap<>();
        for (Map.Entry<String, List<String>> entry : consumers.entrySet()) {
            if (entry.getValue().size() > 1) {
                shared.put(entry.getKey(), entry.getValue().stream().sorted().distinct().toList());
            }
        }
        return shared;
    }
}
