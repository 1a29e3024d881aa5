package com.asad.player_profiler.model;

import java.util.List;
import java.util.Map;

/**
 * Agreement between repeated clusterings of the same matrix under different seeds.
 * Agreement is the Adjusted Rand Index.
 *
 * @param runLabels per-seed labels, empty unless requested
 */
public record StabilityReport(
        int k,
        int repetitions,
        List<Long> seeds,
        double threshold,
        double meanAgreement,
        double stdAgreement,
        double minAgreement,
        double medianAgreement,
        double maxAgreement,
        double[] pairwiseAgreement,
        double meanAgreementWithReference,
        Map<Long, int[]> runLabels,
        boolean stable
) {}
