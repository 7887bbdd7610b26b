package dev.depgraph.graph;

/**
 * Construction flags. Two graphs are only comparable (diffable) when built with equal options.
 */
public record BuildOptions(
        boolean includeSubTargets,
        boolean hideTransient,
        boolean resolveTransitive,
        boolean stableIds
) {
    public static BuildOptions defaults() {
        return new BuildOptions(false, false, false, true);
    }

    public BuildOptions withSubTargets(boolean v) {
        return new BuildOptions(v, hideTransient, resolveTransitive, stableIds);
    }

    public BuildOptions withHideTransient(boolean v) {
        return new BuildOptions(includeSubTargets, v, resolveTransitive, stableIds);
    }

    public BuildOptions withResolveTransitive(boolean v) {
        return new BuildOptions(includeSubTargets, hideTransient, v, stableIds);
    }

    public BuildOptions withStableIds(boolean v) {
        return new BuildOptions(includeSubTargets, hideTransient, resolveTransitive, v);
    }
}
