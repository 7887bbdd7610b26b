package dev.depgraph.analysis;

import dev.depgraph.model.NodeKind;

/**
 * Per-node result of one analysis run.
 */
public record PinchPointInfo(
        String id,
        String name,
        NodeKind kind,
        int directDependents,
        int transitiveDependents,
        int directDependencies,
        int transitiveDependencies,
        int dependencyDepth,
        int cycleSize,            // size of the node's strongly connected component
        double impactScore,
        double vulnerabilityScore,
        RiskTier riskTier
) {
    public boolean inCycle() {
        return cycleSize > 1;
    }
}
