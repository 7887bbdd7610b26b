package dev.depgraph.graph;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.model.DependencyInfo;
import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;
import dev.depgraph.model.IdScheme;
import dev.depgraph.model.Ids;
import dev.depgraph.model.NodeKind;
import dev.depgraph.model.SubTarget;
import dev.depgraph.resolve.TransitiveAugmenter;

/**
 * Merges dependency records into one graph.
 * <p>
 * {@link #addNode} and {@link #addEdge} are the only mutation operations. Both are idempotent:
 * re-adding a node applies the kind upgrade table and can only clear {@code isTransient},
 * re-adding an edge is a no-op. Merging records is therefore independent of record order.
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    private final Path scanRoot;
    private final BuildOptions options;
    private final TransitiveAugmenter augmenter;

    private final Map<String, GraphNode> nodes = new HashMap<>();
    private final Set<Edge> edges = new HashSet<>();

    public GraphBuilder(Path scanRoot, BuildOptions options) {
        this(scanRoot, options, null);
    }

    public GraphBuilder(Path scanRoot, BuildOptions options, TransitiveAugmenter augmenter) {
        this.scanRoot = scanRoot;
        this.options = Objects.requireNonNull(options, "options");
        this.augmenter = augmenter;
    }

    public GraphNode addNode(String id, String name, NodeKind kind, boolean isTransient) {
        final GraphNode observed = GraphNode.of(id, name, kind, isTransient);
        return nodes.merge(id, observed, GraphNode::mergedWith);
    }

    /**
     * Adds {@code from -> to}. Self edges are ignored.
     *
     * @return true if the edge was new
     */
    public boolean addEdge(String from, String to) {
        if (from.equals(to)) {
            return false;
        }
        return edges.add(new Edge(from, to));
    }

    public Graph snapshot() {
        return new Graph(nodes, edges, options);
    }

    /**
     * Merges the records into this builder and returns the finished graph (layers assigned,
     * transient nodes dropped when the options ask for it).
     */
    public Graph build(List<DependencyInfo> records) {
        Objects.requireNonNull(records, "records");

        // Step 1+2: local modules and the global explicit set, before any node exists
        final IdentityTable identities = IdentityTable.from(records);

        // Step 3: nodes and edges per record
        for (DependencyInfo info : records) {
            mergeRecord(info, identities);
        }

        // Optional: real package-to-package edges
        if (options.resolveTransitive() && augmenter != null) {
            for (DependencyInfo info : records) {
                augmenter.augment(info, ownerId(info), this, identities, options.hideTransient());
            }
            LOG.debug("Resolution command invoked {} time(s) for {} record(s)",
                    augmenter.cache().invocations(), records.size());
        }

        final Graph graph = LayerAssigner.assign(snapshot());
        LOG.debug("Built graph with {} nodes and {} edges", graph.nodes().size(), graph.edges().size());
        return options.hideTransient() ? graph.withoutTransient() : graph;
    }

    String ownerId(DependencyInfo info) {
        if (info.declaresItself()) {
            return Ids.moduleId(info.name());
        }
        final IdScheme scheme = options.stableIds() ? IdScheme.STABLE : IdScheme.LEGACY;
        return Ids.containerId(info.name(), Ids.pathKey(info.path(), scanRoot, scheme));
    }

    private void mergeRecord(DependencyInfo info, IdentityTable identities) {
        final String ownerId = ownerId(info);
        final NodeKind ownerKind = info.declaresItself() ? NodeKind.INTERNAL_MODULE : NodeKind.CONTAINER;
        addNode(ownerId, info.name().trim(), ownerKind, false);

        final String self = Ids.normalizeName(info.name());
        final Set<String> referenced = new LinkedHashSet<>(info.dependencies());
        referenced.addAll(new TreeSet<>(info.explicitDependencies()));

        final Set<String> coveredByTargets = new HashSet<>();
        if (options.includeSubTargets() && !info.subTargets().isEmpty()) {
            for (SubTarget target : info.subTargets()) {
                final String targetId = Ids.subTargetId(ownerId, target.name());
                addNode(targetId, target.name(), NodeKind.SUB_TARGET, false);
                addEdge(ownerId, targetId);

                for (String sibling : target.siblingDependencies()) {
                    final String siblingId = Ids.subTargetId(ownerId, sibling);
                    addNode(siblingId, sibling, NodeKind.SUB_TARGET, false);
                    addEdge(targetId, siblingId);
                }
                // a leaf package change only reaches the targets that import it
                for (String pkg : target.packageDependencies()) {
                    if (self.equals(Ids.normalizeName(pkg))) {
                        continue;
                    }
                    addDependency(targetId, pkg, identities);
                    coveredByTargets.add(Ids.normalizeName(pkg));
                }
            }
        }

        for (String dep : referenced) {
            final String key = Ids.normalizeName(dep);
            if (key.isEmpty() || key.equals(self) || coveredByTargets.contains(key)) {
                continue;
            }
            addDependency(ownerId, dep, identities);
        }
    }

    private void addDependency(String fromId, String depName, IdentityTable identities) {
        final NodeKind kind = identities.isLocal(depName) ? NodeKind.INTERNAL_MODULE : NodeKind.EXTERNAL_MODULE;
        final String depId = Ids.moduleId(depName);
        addNode(depId, depName.trim(), kind, identities.isTransient(depName));
        addEdge(fromId, depId);
    }
}
