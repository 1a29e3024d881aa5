package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.model.ClusteringFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

/**
 * Lloyd's K-Means with k-means++ seeding.
 *
 * <p>Every random draw comes from a {@link Random} built from the seed passed in, so the same
 * matrix and seed always give the same labels and centroids. {@code restarts} initialisations
 * are tried and the lowest inertia wins (the earliest on a tie).
 *
 * <p>Labels are canonical: centroids are sorted on their coordinates starting at the order
 * column (the offensive efficiency index for player matrices), then the remaining columns.
 * Two fits that find the same partition therefore number it the same way.
 */
@Slf4j
@Service
public class KMeansClusterer {

    private final int maxIterations;
    private final int restarts;
    private final int orderColumn;

    public record KMeansFit(
            int[] labels,
            double[][] centroids,
            double[] distances,
            double inertia,
            int iterations,
            boolean converged,
            long seed
    ) {
        public KMeansFit {
            labels = labels.clone();
            centroids = copy(centroids);
            distances = distances.clone();
        }

        @Override
        public int[] labels() {
            return labels.clone();
        }

        @Override
        public double[][] centroids() {
            return copy(centroids);
        }

        @Override
        public double[] distances() {
            return distances.clone();
        }

        public int k() {
            return centroids.length;
        }

        private static double[][] copy(double[][] src) {
            double[][] out = new double[src.length][];
            for (int i = 0; i < src.length; i++) out[i] = src[i].clone();
            return out;
        }
    }

    @Autowired
    public KMeansClusterer(ProfilerProperties properties) {
        this(properties.getClustering().getMaxIterations(),
                properties.getClustering().getRestarts(),
                ClusteringFeature.OER.ordinal());
    }

    public KMeansClusterer(int maxIterations, int restarts, int orderColumn) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (restarts < 1) throw new IllegalArgumentException("restarts must be >= 1");
        this.maxIterations = maxIterations;
        this.restarts = restarts;
        this.orderColumn = orderColumn;
    }

    public KMeansFit fit(double[][] data, int k, long seed) {
        int n = data.length;
        if (k < 1 || k > n) {
            throw new IllegalArgumentException("k=" + k + " is out of range for " + n + " points");
        }

        Random rng = new Random(seed);
        KMeansFit best = null;
        for (int r = 0; r < restarts; r++) {
            KMeansFit candidate = lloyd(data, k, rng.nextLong());
            if (best == null || candidate.inertia() < best.inertia()) {
                best = candidate;
            }
        }

        if (!best.converged()) {
            log.warn("K-Means (k={}, seed={}) hit the {} iteration cap before assignments settled",
                    k, seed, maxIterations);
        }
        return canonicalize(best, seed);
    }

    private KMeansFit lloyd(double[][] data, int k, long initSeed) {
        int n = data.length;
        double[][] centroids = initPlusPlus(data, k, new Random(initSeed));
        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        // squared until canonicalize()
        double[] dist = new double[n];

        boolean converged = false;
        int iterations = 0;
        while (iterations < maxIterations) {
            iterations++;
            boolean changed = assign(data, centroids, labels, dist);
            if (!changed) {
                converged = true;
                break;
            }
            int[] counts = recompute(data, labels, centroids);
            reseedEmpty(data, centroids, counts, dist);
        }
        if (!converged) {
            // keep labels consistent with the centroids we return
            assign(data, centroids, labels, dist);
        }

        double inertia = 0.0;
        for (double d : dist) inertia += d;
        return new KMeansFit(labels, centroids, dist, inertia, iterations, converged, initSeed);
    }

    /** k-means++: first centroid uniform, the rest drawn with probability proportional to D(x)^2. */
    static double[][] initPlusPlus(double[][] data, int k, Random rand) {
        int n = data.length;
        double[][] centroids = new double[k][];
        centroids[0] = data[rand.nextInt(n)].clone();

        double[] minDist = new double[n];
        Arrays.fill(minDist, Double.POSITIVE_INFINITY);

        for (int c = 1; c < k; c++) {
            double sum = 0.0;
            for (int j = 0; j < n; j++) {
                minDist[j] = Math.min(minDist[j], squaredDistance(data[j], centroids[c - 1]));
                sum += minDist[j];
            }

            int chosen = -1;
            if (sum > 0.0) {
                double r = rand.nextDouble() * sum;
                double cumulative = 0.0;
                for (int j = 0; j < n; j++) {
                    if (minDist[j] <= 0.0) continue;
                    cumulative += minDist[j];
                    chosen = j;
                    if (cumulative >= r) break;
                }
            }
            if (chosen < 0) {
                // every point already sits on a centroid
                chosen = rand.nextInt(n);
            }
            centroids[c] = data[chosen].clone();
        }
        return centroids;
    }

    /** Nearest centroid per point (lowest index on ties). Returns whether any label changed. */
    static boolean assign(double[][] data, double[][] centroids, int[] labels, double[] dist) {
        boolean changed = false;
        for (int i = 0; i < data.length; i++) {
            int best = 0;
            double bestDist = Double.POSITIVE_INFINITY;
            for (int c = 0; c < centroids.length; c++) {
                double d = squaredDistance(data[i], centroids[c]);
                if (d < bestDist) {
                    bestDist = d;
                    best = c;
                }
            }
            if (labels[i] != best) {
                labels[i] = best;
                changed = true;
            }
            dist[i] = bestDist;
        }
        return changed;
    }

    static int[] recompute(double[][] data, int[] labels, double[][] centroids) {
        int k = centroids.length;
        int d = data[0].length;
        double[][] sums = new double[k][d];
        int[] counts = new int[k];
        for (int i = 0; i < data.length; i++) {
            int c = labels[i];
            counts[c]++;
            for (int j = 0; j < d; j++) sums[c][j] += data[i][j];
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) continue;
            for (int j = 0; j < d; j++) centroids[c][j] = sums[c][j] / counts[c];
        }
        return counts;
    }

    /**
     * Moves every empty centroid onto the point currently farthest from its own centroid.
     * A point used for one reseed is not reused for another.
     */
    static void reseedEmpty(double[][] data, double[][] centroids, int[] counts, double[] dist) {
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] > 0) continue;

            int far = 0;
            for (int i = 1; i < data.length; i++) {
                if (dist[i] > dist[far]) far = i;
            }
            centroids[c] = data[far].clone();
            dist[far] = 0.0;
            log.debug("Reseeded empty cluster {} at point {}", c, far);
        }
    }

    KMeansFit canonicalize(KMeansFit fit, long seed) {
        double[][] centroids = fit.centroids();
        int k = centroids.length;
        int width = centroids[0].length;
        int first = orderColumn < width ? orderColumn : 0;

        Comparator<double[]> byKey = (a, b) -> {
            int cmp = Double.compare(a[first], b[first]);
            if (cmp != 0) return cmp;
            for (int j = 0; j < width; j++) {
                if (j == first) continue;
                cmp = Double.compare(a[j], b[j]);
                if (cmp != 0) return cmp;
            }
            return 0;
        };

        Integer[] order = new Integer[k];
        for (int c = 0; c < k; c++) order[c] = c;
        Arrays.sort(order, (x, y) -> byKey.compare(centroids[x], centroids[y]));

        int[] relabel = new int[k];
        double[][] sorted = new double[k][];
        for (int pos = 0; pos < k; pos++) {
            relabel[order[pos]] = pos;
            sorted[pos] = centroids[order[pos]];
        }

        int[] raw = fit.labels();
        double[] squared = fit.distances();
        int[] labels = new int[raw.length];
        double[] distances = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            labels[i] = relabel[raw[i]];
            distances[i] = Math.sqrt(squared[i]);
        }
        return new KMeansFit(labels, sorted, distances, fit.inertia(), fit.iterations(), fit.converged(), seed);
    }

    static double squaredDistance(double[] a, double[] b) {
        double s = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            s += d * d;
        }
        return s;
    }
}
