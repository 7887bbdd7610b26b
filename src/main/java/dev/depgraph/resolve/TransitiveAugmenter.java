package dev.depgraph.resolve;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.graph.GraphBuilder;
import dev.depgraph.graph.IdentityTable;
import dev.depgraph.model.DependencyInfo;
import dev.depgraph.model.Ids;
import dev.depgraph.model.NodeKind;

/**
 * Adds package-to-package edges from the resolved dependency tree of each package record.
 * <p>
 * Only records with a manifest of their own are resolved; containers such as app projects have
 * nothing for the package manager to resolve. Nodes are keyed by the package identity the tool
 * reports, the declared name is kept for display only.
 * <p>
 * Direct children of the root are explicit. Deeper packages are transient unless something in
 * scope declares them. With {@code depthLimited} the walk adds the grandchildren (as transient)
 * but does not expand them.
 */
public final class TransitiveAugmenter {

    private static final Logger LOG = LoggerFactory.getLogger(TransitiveAugmenter.class);

    private final ResolutionCache cache;

    public TransitiveAugmenter(ResolutionCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public ResolutionCache cache() {
        return cache;
    }

    public void augment(DependencyInfo record,
                        String ownerId,
                        GraphBuilder builder,
                        IdentityTable identities,
                        boolean depthLimited) {
        if (record.path() == null || !record.declaresItself()) {
            return;
        }
        final String identity = Ids.stripNamespace(ownerId);
        final Optional<ResolvedPackage> resolved = cache.resolve(identity, record.path());
        if (resolved.isEmpty()) {
            LOG.debug("No resolution data for {}, keeping known edges", record.name());
            return;
        }

        final Set<String> expanded = new HashSet<>();
        final Deque<Step> stack = new ArrayDeque<>();
        for (ResolvedPackage child : resolved.get().dependencies()) {
            stack.push(new Step(ownerId, child, 1));
        }

        while (!stack.isEmpty()) {
            final Step step = stack.pop();
            final String key = step.pkg().key();
            if (key.isBlank()) {
                continue;
            }
            final String name = step.pkg().displayName();
            final String id = Ids.moduleId(key);
            final boolean local = identities.isLocal(key) || identities.isLocal(name);
            final NodeKind kind = local ? NodeKind.INTERNAL_MODULE : NodeKind.EXTERNAL_MODULE;
            final boolean isTransient = step.depth() > 1
                    && (depthLimited || (identities.isTransient(key) && identities.isTransient(name)));

            builder.addNode(id, name, kind, isTransient);
            builder.addEdge(step.parentId(), id);

            if (depthLimited && step.depth() > 1) {
                continue;
            }
            if (!expanded.add(id)) {
                continue;
            }
            for (ResolvedPackage child : step.pkg().dependencies()) {
                stack.push(new Step(id, child, step.depth() + 1));
            }
        }
    }

    private record Step(String parentId, ResolvedPackage pkg, int depth) {
    }
}
