package dev.depgraph.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * DAG with one vertex per strongly connected component. Component ids follow the emission
 * order of {@link StronglyConnectedComponents}, so successors always have smaller ids than
 * their predecessors.
 */
public final class Condensation {

    private final StronglyConnectedComponents sccs;
    private final List<BitSet> successors;
    private final List<BitSet> predecessors;

    private Condensation(StronglyConnectedComponents sccs, List<BitSet> successors, List<BitSet> predecessors) {
        this.sccs = sccs;
        this.successors = successors;
        this.predecessors = predecessors;
    }

    public static Condensation of(int[][] adjacency, StronglyConnectedComponents sccs) {
        final int c = sccs.count();
        final List<BitSet> succ = new ArrayList<>(c);
        final List<BitSet> pred = new ArrayList<>(c);
        for (int i = 0; i < c; i++) {
            succ.add(new BitSet(c));
            pred.add(new BitSet(c));
        }
        for (int v = 0; v < adjacency.length; v++) {
            final int from = sccs.componentOf(v);
            for (int w : adjacency[v]) {
                final int to = sccs.componentOf(w);
                if (from != to) {
                    succ.get(from).set(to);
                    pred.get(to).set(from);
                }
            }
        }
        return new Condensation(sccs, succ, pred);
    }

    public int size() {
        return sccs.count();
    }

    public StronglyConnectedComponents components() {
        return sccs;
    }

    public BitSet successors(int component) {
        return successors.get(component);
    }

    public BitSet predecessors(int component) {
        return predecessors.get(component);
    }

    /**
     * depth = 0 for a component without successors, else 1 + max depth of its successors.
     * Successors are emitted first, so a single forward pass sees every child before its parent.
     */
    public int[] depths() {
        final int[] depth = new int[size()];
        for (int c = 0; c < size(); c++) {
            int max = -1;
            final BitSet succ = successors.get(c);
            for (int s = succ.nextSetBit(0); s >= 0; s = succ.nextSetBit(s + 1)) {
                max = Math.max(max, depth[s]);
            }
            depth[c] = max + 1;
        }
        return depth;
    }

    /**
     * Components reachable forward from each component, excluding the component itself.
     * Union over successors, so shared sub-paths are counted once.
     */
    public List<BitSet> reachableForward() {
        final List<BitSet> reach = new ArrayList<>(size());
        for (int c = 0; c < size(); c++) {
            final BitSet r = new BitSet(size());
            final BitSet succ = successors.get(c);
            for (int s = succ.nextSetBit(0); s >= 0; s = succ.nextSetBit(s + 1)) {
                r.set(s);
                r.or(reach.get(s));
            }
            reach.add(r);
        }
        return reach;
    }

    /**
     * Components that can reach each component, excluding the component itself.
     */
    public List<BitSet> reachableBackward() {
        final BitSet[] reach = new BitSet[size()];
        for (int c = size() - 1; c >= 0; c--) {
            final BitSet r = new BitSet(size());
            final BitSet pred = predecessors.get(c);
            for (int p = pred.nextSetBit(0); p >= 0; p = pred.nextSetBit(p + 1)) {
                r.set(p);
                r.or(reach[p]);
            }
            reach[c] = r;
        }
        return List.of(reach);
    }

    /**
     * Number of underlying nodes in the given set of components.
     */
    public int nodeCount(BitSet componentSet) {
        int total = 0;
        for (int c = componentSet.nextSetBit(0); c >= 0; c = componentSet.nextSetBit(c + 1)) {
            total += sccs.sizeOf(c);
        }
        return total;
    }
}
