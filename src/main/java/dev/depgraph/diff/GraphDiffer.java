package dev.depgraph.diff;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.graph.Graph;

/**
 * Compares two snapshots. Both must come from the same construction options; a mismatch is
 * reported in the log and otherwise left alone, since the result is then not meaningful.
 */
public final class GraphDiffer {

    private static final Logger LOG = LoggerFactory.getLogger(GraphDiffer.class);

    private GraphDiffer() {
    }

    public static GraphDiff diff(Graph from, Graph to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!from.options().equals(to.options())) {
            LOG.warn("Diffing graphs built with different options ({} vs {}); expect false positives",
                    from.options(), to.options());
        }

        final Set<String> fromNodes = from.nodes().keySet();
        final Set<String> toNodes = to.nodes().keySet();
        final Set<String> fromEdges = from.edgeKeys();
        final Set<String> toEdges = to.edgeKeys();

        return new GraphDiff(
                minus(toNodes, fromNodes),
                minus(fromNodes, toNodes),
                minus(toEdges, fromEdges),
                minus(fromEdges, toEdges));
    }

    private static Set<String> minus(Set<String> a, Set<String> b) {
        final Set<String> out = new TreeSet<>(a);
        out.removeAll(b);
        return out;
    }
}
