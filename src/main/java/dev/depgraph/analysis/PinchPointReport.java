package dev.depgraph.analysis;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

public record PinchPointReport(
        List<PinchPointInfo> points,
        int maxDepth
) {
    public PinchPointReport {
        points = List.copyOf(points);
    }

    public Optional<PinchPointInfo> point(String id) {
        return points.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    public List<PinchPointInfo> topByImpact(int n) {
        return top(n, PinchPointInfo::impactScore);
    }

    public List<PinchPointInfo> topByVulnerability(int n) {
        return top(n, PinchPointInfo::vulnerabilityScore);
    }

    /**
     * Score descending, ties by name then id ascending.
     */
    public List<PinchPointInfo> top(int n, ToDoubleFunction<PinchPointInfo> score) {
        final Comparator<PinchPointInfo> order = Comparator
                .comparingDouble(score).reversed()
                .thenComparing(PinchPointInfo::name)
                .thenComparing(PinchPointInfo::id);
        return points.stream().sorted(order).limit(Math.max(0, n)).toList();
    }

    public List<PinchPointInfo> atTier(RiskTier tier) {
        return points.stream().filter(p -> p.riskTier() == tier).toList();
    }
}
