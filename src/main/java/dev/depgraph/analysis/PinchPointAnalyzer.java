package dev.depgraph.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.graph.Graph;
import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;
import dev.depgraph.model.NodeKind;

/**
 * Finds pinch points: nodes whose change invalidates a large part of the graph.
 * <p>
 * All counting happens on the condensation DAG, so members of one cycle are treated as one
 * unit and never count each other, and nodes reached along several paths count once.
 * Edges to unknown nodes are ignored. Pure function of the graph.
 */
public final class PinchPointAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PinchPointAnalyzer.class);

    private final PinchPointPolicy policy;

    public PinchPointAnalyzer() {
        this(PinchPointPolicy.defaults());
    }

    public PinchPointAnalyzer(PinchPointPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public PinchPointReport analyze(Graph graph, boolean internalOnly) {
        Objects.requireNonNull(graph, "graph");

        // Step 1: index every node; SCCs run over the full edge set
        final List<GraphNode> all = new ArrayList<>(graph.nodes().values());
        final Map<String, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < all.size(); i++) {
            indexOf.put(all.get(i).id(), i);
        }
        final int[][] adjacency = adjacency(graph, indexOf, all.size());

        // Step 2+3: components and condensation
        final StronglyConnectedComponents sccs = StronglyConnectedComponents.compute(adjacency);
        final Condensation dag = Condensation.of(adjacency, sccs);

        // Step 4+5: depth and reachability per component
        final int[] depth = dag.depths();
        final List<BitSet> forward = dag.reachableForward();
        final List<BitSet> backward = dag.reachableBackward();

        final List<PinchPointInfo> points = new ArrayList<>();
        int maxDepth = 0;
        for (int v = 0; v < all.size(); v++) {
            final GraphNode node = all.get(v);
            if (!isCandidate(node, internalOnly)) {
                continue;
            }
            final int c = sccs.componentOf(v);
            final int transitiveDependents = dag.nodeCount(backward.get(c));
            final int transitiveDependencies = dag.nodeCount(forward.get(c));

            // Step 6+7: scores and tier
            points.add(new PinchPointInfo(
                    node.id(),
                    node.name(),
                    node.kind(),
                    dag.nodeCount(dag.predecessors(c)),
                    transitiveDependents,
                    dag.nodeCount(dag.successors(c)),
                    transitiveDependencies,
                    depth[c],
                    sccs.sizeOf(c),
                    policy.impactScore(transitiveDependents, depth[c]),
                    transitiveDependencies,
                    RiskTier.of(transitiveDependents, policy)
            ));
            maxDepth = Math.max(maxDepth, depth[c]);
        }

        LOG.debug("Analyzed {} candidate node(s) in {} component(s), max depth {}",
                points.size(), sccs.count(), maxDepth);
        return new PinchPointReport(points, maxDepth);
    }

    public PinchPointPolicy policy() {
        return policy;
    }

    private static boolean isCandidate(GraphNode node, boolean internalOnly) {
        if (node.isTransient()) {
            return false;
        }
        return !(internalOnly && node.kind() == NodeKind.EXTERNAL_MODULE);
    }

    private static int[][] adjacency(Graph graph, Map<String, Integer> indexOf, int n) {
        final List<Set<Integer>> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new LinkedHashSet<>());
        }
        for (Edge e : graph.edges()) {
            final Integer from = indexOf.get(e.from());
            final Integer to = indexOf.get(e.to());
            if (from == null || to == null) {
                LOG.debug("Ignoring dangling edge {}", e.key());
                continue;
            }
            out.get(from).add(to);
        }
        final int[][] adjacency = new int[n][];
        for (int i = 0; i < n; i++) {
            adjacency[i] = out.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return adjacency;
    }
}
