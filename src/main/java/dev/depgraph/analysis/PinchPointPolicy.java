package dev.depgraph.analysis;

/**
 * Scoring policy. The defaults (20 / 10 / 5 dependents, depth weight 0.2) are reasonable
 * starting values, not derived constants.
 */
public record PinchPointPolicy(
        int criticalThreshold,
        int highThreshold,
        int mediumThreshold,
        double depthWeight,
        int defaultTop
) {
    public static final int DEFAULT_CRITICAL = 20;
    public static final int DEFAULT_HIGH = 10;
    public static final int DEFAULT_MEDIUM = 5;
    public static final double DEFAULT_DEPTH_WEIGHT = 0.2;
    public static final int DEFAULT_TOP = 10;

    public PinchPointPolicy {
        if (mediumThreshold > highThreshold || highThreshold > criticalThreshold) {
            throw new IllegalArgumentException("thresholds must satisfy medium <= high <= critical, got "
                    + mediumThreshold + "/" + highThreshold + "/" + criticalThreshold);
        }
        if (depthWeight < 0) {
            throw new IllegalArgumentException("depthWeight must not be negative: " + depthWeight);
        }
    }

    public static PinchPointPolicy defaults() {
        return new PinchPointPolicy(DEFAULT_CRITICAL, DEFAULT_HIGH, DEFAULT_MEDIUM, DEFAULT_DEPTH_WEIGHT, DEFAULT_TOP);
    }

    public double impactScore(int transitiveDependents, int depth) {
        return transitiveDependents * (1 + depth * depthWeight);
    }
}
