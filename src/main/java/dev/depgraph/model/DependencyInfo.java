package dev.depgraph.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * One discovered container (a package directory, a project) as reported by a reader.
 * <p>
 * {@code dependencies} is usually lockfile-derived and cannot tell direct from indirect
 * references; {@code explicitDependencies} is what the container itself declares and is the
 * only input used for explicit/transient classification. A record listing its own name in
 * {@code explicitDependencies} is a locally owned module.
 */
public record DependencyInfo(
        Path path,
        String name,
        List<String> dependencies,
        Set<String> explicitDependencies,
        List<SubTarget> subTargets
) {
    public DependencyInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        explicitDependencies = explicitDependencies == null ? Set.of() : Set.copyOf(explicitDependencies);
        subTargets = subTargets == null ? List.of() : List.copyOf(subTargets);
    }

    public static DependencyInfo of(Path path, String name, List<String> dependencies, Set<String> explicit) {
        return new DependencyInfo(path, name, dependencies, explicit, List.of());
    }

    public boolean declaresItself() {
        final String self = Ids.normalizeName(name);
        for (String e : explicitDependencies) {
            if (self.equals(Ids.normalizeName(e))) {
                return true;
            }
        }
        return false;
    }
}
