package com.asad.player_profiler.model;

import java.util.List;

/**
 * @param explainedVarianceRatio one entry per component, descending
 * @param cumulativeVariance     running sum of the ratios, ends at ~1.0
 * @param components             top component loadings, one row per component
 * @param projections            one row per player, {@code components.length} columns
 */
public record PcaResult(
        double[] explainedVarianceRatio,
        double[] cumulativeVariance,
        double[][] components,
        List<Projection> projections
) {

    public record Projection(String playerId, double[] coordinates) {}

    /** Number of components needed to reach the given share of variance. */
    public int componentsFor(double share) {
        for (int i = 0; i < cumulativeVariance.length; i++) {
            if (cumulativeVariance[i] >= share) return i + 1;
        }
        return cumulativeVariance.length;
    }
}
