package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.DegenerateInputException;
import com.asad.player_profiler.model.CandidateScore;
import com.asad.player_profiler.model.ModelSelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.Callable;

/**
 * Picks the cluster count with the best silhouette. Candidates are fitted in parallel,
 * each with the same seed; ties go to the smaller K.
 */
@Slf4j
@Service
public class ModelSelectionService {

    private final KMeansClusterer clusterer;
    private final TaskFanOut fanOut;
    private final double acceptableSilhouette;

    public ModelSelectionService(KMeansClusterer clusterer, TaskFanOut fanOut, ProfilerProperties properties) {
        this.clusterer = clusterer;
        this.fanOut = fanOut;
        this.acceptableSilhouette = properties.getClustering().getAcceptableSilhouette();
    }

    public ModelSelection select(double[][] matrix, int minK, int maxK, long seed) {
        int n = matrix.length;
        if (minK < 2) {
            throw new DegenerateInputException("smallest candidate K must be >= 2, got " + minK);
        }
        if (maxK < minK) {
            throw new IllegalArgumentException("empty K range [" + minK + ", " + maxK + "]");
        }
        int distinct = distinctRows(matrix);
        if (distinct < minK) {
            throw new DegenerateInputException(n + " players with " + distinct
                    + " distinct profiles cannot be split into " + minK + " clusters");
        }

        // no K beyond the distinct profiles; without duplicates the silhouette needs K <= n - 1,
        // except when the population is exactly minK
        int limit = distinct < n ? distinct : Math.max(minK, n - 1);
        int upper = Math.min(maxK, limit);
        if (upper < maxK) {
            log.info("Capping K range at {} for {} players ({} distinct)", upper, n, distinct);
        }

        Map<Integer, Callable<CandidateScore>> tasks = new LinkedHashMap<>();
        for (int k = minK; k <= upper; k++) {
            int candidate = k;
            tasks.put(candidate, () -> score(matrix, candidate, seed));
        }

        SortedMap<Integer, CandidateScore> table = fanOut.run("K scan", tasks);
        List<CandidateScore> scores = new ArrayList<>(table.values());
        for (CandidateScore s : scores) {
            log.info("K={} silhouette={} inertia={}", s.k(), fmt(s.silhouette()), fmt(s.inertia()));
        }

        CandidateScore best = pickBest(scores);
        if (best.silhouette() < acceptableSilhouette) {
            log.warn("Best silhouette {} at K={} is below the acceptable {}; structure is weak",
                    fmt(best.silhouette()), best.k(), acceptableSilhouette);
        }
        log.info("Selected K={} (silhouette {})", best.k(), fmt(best.silhouette()));
        return new ModelSelection(best.k(), best.silhouette(), seed, scores);
    }

    CandidateScore score(double[][] matrix, int k, long seed) {
        KMeansClusterer.KMeansFit fit = clusterer.fit(matrix, k, seed);
        double silhouette = SilhouetteScorer.score(matrix, fit.labels(), k);
        return new CandidateScore(k, silhouette, fit.inertia(), fit.converged());
    }

    /** Highest silhouette; scores must be ascending by K so the first maximum is the smallest K. */
    static CandidateScore pickBest(List<CandidateScore> ascending) {
        CandidateScore best = null;
        for (CandidateScore s : ascending) {
            if (best == null || s.silhouette() > best.silhouette()) best = s;
        }
        if (best == null) throw new DegenerateInputException("no candidate K could be scored");
        return best;
    }

    static int distinctRows(double[][] matrix) {
        Set<List<Double>> rows = new HashSet<>();
        for (double[] row : matrix) {
            rows.add(Arrays.stream(row).boxed().toList());
        }
        return rows.size();
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }
}
