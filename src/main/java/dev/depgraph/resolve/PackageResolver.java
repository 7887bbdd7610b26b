package dev.depgraph.resolve;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves the full package dependency tree of the package rooted at a directory.
 * Implementations never throw for tool-level failures: a missing tool, a non-zero exit or
 * unparsable output all come back as {@link Optional#empty()}.
 */
@FunctionalInterface
public interface PackageResolver {

    Optional<ResolvedPackage> resolve(Path packageRoot);
}
