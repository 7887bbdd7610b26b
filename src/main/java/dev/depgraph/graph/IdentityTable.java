package dev.depgraph.graph;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import dev.depgraph.model.DependencyInfo;
import dev.depgraph.model.Ids;

/**
 * Run-wide name facts needed before any node is added:
 * - local names: records that declare themselves (locally owned modules)
 * - explicit names: union of every record's explicit dependencies
 */
public final class IdentityTable {

    private final Set<String> localNames = new HashSet<>();
    private final Set<String> explicitNames = new HashSet<>();

    public static IdentityTable from(Collection<DependencyInfo> records) {
        final IdentityTable table = new IdentityTable();
        for (DependencyInfo info : records) {
            table.register(info);
        }
        return table;
    }

    public void register(DependencyInfo info) {
        if (info.declaresItself()) {
            localNames.add(Ids.normalizeName(info.name()));
        }
        for (String e : info.explicitDependencies()) {
            explicitNames.add(Ids.normalizeName(e));
        }
    }

    public boolean isLocal(String name) {
        return localNames.contains(Ids.normalizeName(name));
    }

    public boolean isExplicit(String name) {
        return explicitNames.contains(Ids.normalizeName(name));
    }

    /**
     * A reference is transient when nothing in scope declares it directly and it is not a
     * locally owned module.
     */
    public boolean isTransient(String name) {
        return !isExplicit(name) && !isLocal(name);
    }

    public Set<String> localNames() {
        return Set.copyOf(localNames);
    }
}
