package dev.depgraph.model;

import java.util.List;

/**
 * Nested build unit of a container (an app target, its test target, ...).
 */
public record SubTarget(
        String name,
        List<String> packageDependencies,  // package names imported by this target
        List<String> siblingDependencies   // names of other sub-targets of the same container
) {
    public SubTarget {
        packageDependencies = packageDependencies == null ? List.of() : List.copyOf(packageDependencies);
        siblingDependencies = siblingDependencies == null ? List.of() : List.copyOf(siblingDependencies);
    }
}
