package com.asad.player_profiler.service;

import java.util.Arrays;

/**
 * Mean silhouette coefficient: for every point, (b - a) / max(a, b) where a is the mean distance
 * to the rest of its own cluster and b the mean distance to the nearest other cluster.
 * Points in singleton clusters score 0. Range [-1, 1].
 */
public final class SilhouetteScorer {

    private SilhouetteScorer() {}

    public static double score(double[][] data, int[] labels, int k) {
        double[] per = samples(data, labels, k);
        if (per.length == 0) return 0.0;
        double sum = 0.0;
        for (double s : per) sum += s;
        return sum / per.length;
    }

    public static double[] samples(double[][] data, int[] labels, int k) {
        int n = data.length;
        int[] sizes = new int[k];
        for (int label : labels) sizes[label]++;

        int nonEmpty = 0;
        for (int size : sizes) if (size > 0) nonEmpty++;

        double[] out = new double[n];
        if (nonEmpty < 2) return out;

        double[] sums = new double[k];
        for (int i = 0; i < n; i++) {
            int own = labels[i];
            if (sizes[own] == 1) {
                out[i] = 0.0;
                continue;
            }

            Arrays.fill(sums, 0.0);
            for (int j = 0; j < n; j++) {
                if (j == i) continue;
                sums[labels[j]] += Math.sqrt(KMeansClusterer.squaredDistance(data[i], data[j]));
            }

            double a = sums[own] / (sizes[own] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c == own || sizes[c] == 0) continue;
                b = Math.min(b, sums[c] / sizes[c]);
            }

            double denom = Math.max(a, b);
            out[i] = denom > 0.0 ? (b - a) / denom : 0.0;
        }
        return out;
    }
}
