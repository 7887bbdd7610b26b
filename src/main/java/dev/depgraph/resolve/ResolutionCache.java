package dev.depgraph.resolve;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.model.Ids;

/**
 * One resolution per canonical package root within one scanned tree.
 * <p>
 * Identity keys are only meaningful inside a single snapshot. Use one cache per scanned tree.
 * <p>
 * Lookups go by package identity first, then by the real (symlink-free, normalized) root
 * path. Every result is filed under the requested identity, the root path and the identity the
 * tool reported, so roots reached through different references converge on one call.
 * Failures are cached as well.
 */
public final class ResolutionCache {

    private static final Logger LOG = LoggerFactory.getLogger(ResolutionCache.class);

    private final PackageResolver resolver;
    private final Map<String, Optional<ResolvedPackage>> byIdentity = new HashMap<>();
    private final Map<Path, Optional<ResolvedPackage>> byRoot = new HashMap<>();
    private int invocations;

    public ResolutionCache(PackageResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public synchronized Optional<ResolvedPackage> resolve(String identity, Path root) {
        Objects.requireNonNull(root, "root");
        final String idKey = Ids.normalizeName(identity);

        final Optional<ResolvedPackage> byId = idKey.isEmpty() ? null : byIdentity.get(idKey);
        if (byId != null) {
            LOG.debug("Resolution cache hit for identity {}", idKey);
            return byId;
        }

        final Path canonical = canonicalize(root);
        Optional<ResolvedPackage> result = byRoot.get(canonical);
        if (result == null) {
            invocations++;
            LOG.debug("Resolving {} ({})", idKey, canonical);
            result = resolver.resolve(canonical);
            byRoot.put(canonical, result);
            if (result.isPresent()) {
                byIdentity.putIfAbsent(Ids.normalizeName(result.get().identity()), result);
            }
        }
        if (!idKey.isEmpty()) {
            byIdentity.putIfAbsent(idKey, result);
        }
        return result;
    }

    public synchronized int invocations() {
        return invocations;
    }

    static Path canonicalize(Path root) {
        try {
            return root.toRealPath();
        } catch (IOException ex) {
            return root.toAbsolutePath().normalize();
        }
    }
}
