package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.model.StabilityReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.Callable;

/**
 * Re-runs the clustering under many seeds and measures how much the partitions agree.
 * Works on its own fits only; the production assignment is read, never changed.
 */
@Slf4j
@Service
public class StabilityService {

    private final KMeansClusterer clusterer;
    private final TaskFanOut fanOut;
    private final ProfilerProperties.Stability config;

    public StabilityService(KMeansClusterer clusterer, TaskFanOut fanOut, ProfilerProperties properties) {
        this.clusterer = clusterer;
        this.fanOut = fanOut;
        this.config = properties.getStability();
    }

    /** Configured seeds, or {@code baseSeed + 1 .. baseSeed + repetitions}. */
    public List<Long> seedsFor(long baseSeed) {
        if (!config.getSeeds().isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(config.getSeeds()));
        }
        List<Long> seeds = new ArrayList<>(config.getRepetitions());
        for (int i = 1; i <= config.getRepetitions(); i++) seeds.add(baseSeed + i);
        return seeds;
    }

    public StabilityReport validate(double[][] matrix, int k, long baseSeed, int[] reference) {
        return validate(matrix, k, seedsFor(baseSeed), config.getThreshold(), reference);
    }

    /**
     * @param reference production labels to compare every run with; null compares with the first run
     */
    public StabilityReport validate(double[][] matrix, int k, List<Long> seeds, double threshold, int[] reference) {
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(seeds));
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("stability needs at least 2 distinct seeds, got " + distinct);
        }

        Map<Long, Callable<int[]>> tasks = new LinkedHashMap<>();
        for (Long seed : distinct) {
            tasks.put(seed, () -> clusterer.fit(matrix, k, seed).labels());
        }
        SortedMap<Long, int[]> runs = fanOut.run("stability scan", tasks);

        List<int[]> ordered = new ArrayList<>(runs.values());
        int pairCount = ordered.size() * (ordered.size() - 1) / 2;
        double[] pairwise = new double[pairCount];
        int p = 0;
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                pairwise[p++] = AgreementMetrics.adjustedRandIndex(ordered.get(i), ordered.get(j));
            }
        }

        int[] ref = reference != null ? reference : ordered.get(0);
        double vsReference = 0.0;
        for (int[] run : ordered) vsReference += AgreementMetrics.adjustedRandIndex(run, ref);
        vsReference /= ordered.size();

        DescriptiveStatistics stats = new DescriptiveStatistics(pairwise);
        double mean = stats.getMean();
        boolean stable = mean >= threshold;

        if (stable) {
            log.info("Clustering at K={} is stable: mean ARI {} over {} runs (threshold {})",
                    k, String.format(Locale.ROOT, "%.4f", mean), ordered.size(), threshold);
        } else {
            log.warn("Clustering at K={} is NOT stable: mean ARI {} over {} runs (threshold {})",
                    k, String.format(Locale.ROOT, "%.4f", mean), ordered.size(), threshold);
        }

        Map<Long, int[]> runLabels = config.isKeepRunLabels() ? new TreeMap<>(runs) : Map.of();
        return new StabilityReport(
                k,
                ordered.size(),
                List.copyOf(runs.keySet()),
                threshold,
                mean,
                stats.getStandardDeviation(),
                stats.getMin(),
                stats.getPercentile(50),
                stats.getMax(),
                pairwise,
                vsReference,
                runLabels,
                stable
        );
    }
}
