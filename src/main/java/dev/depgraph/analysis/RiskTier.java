package dev.depgraph.analysis;

/**
 * Risk bucket by number of transitive dependents. Thresholds come from {@link PinchPointPolicy}.
 */
public enum RiskTier {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static RiskTier of(int transitiveDependents, PinchPointPolicy policy) {
        if (transitiveDependents >= policy.criticalThreshold()) {
            return CRITICAL;
        }
        if (transitiveDependents >= policy.highThreshold()) {
            return HIGH;
        }
        if (transitiveDependents >= policy.mediumThreshold()) {
            return MEDIUM;
        }
        return LOW;
    }
}
