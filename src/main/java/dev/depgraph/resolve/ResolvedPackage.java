package dev.depgraph.resolve;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One node of the dependency tree printed by the package manager's resolution command.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolvedPackage(
        String identity,
        String name,
        String url,
        String version,
        List<ResolvedPackage> dependencies
) {
    public ResolvedPackage {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Graph key of the package: the identity, or the declared name when the tool omits it.
     */
    public String key() {
        if (identity != null && !identity.isBlank()) {
            return identity;
        }
        return name == null ? "" : name;
    }

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return identity == null ? "" : identity;
    }
}
