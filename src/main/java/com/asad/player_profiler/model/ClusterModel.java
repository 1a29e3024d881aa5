package com.asad.player_profiler.model;

/**
 * Fitted centroids in scaled-feature space. One per pipeline run; a re-run replaces it.
 * {@code converged == false} means K-Means stopped at the iteration cap.
 */
public record ClusterModel(
        int k,
        double[][] centroids,
        double silhouette,
        double inertia,
        int iterations,
        boolean converged,
        long seed
) {

    public ClusterModel {
        if (centroids.length != k) {
            throw new IllegalArgumentException("expected " + k + " centroids, got " + centroids.length);
        }
        centroids = copy(centroids);
    }

    @Override
    public double[][] centroids() {
        return copy(centroids);
    }

    /** Label of the closest centroid; ties go to the lower label. */
    public int nearest(double[] scaled) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double d = squaredDistance(scaled, centroids[c]);
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return best;
    }

    public double distanceTo(int label, double[] scaled) {
        return Math.sqrt(squaredDistance(scaled, centroids[label]));
    }

    private static double squaredDistance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double s = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            s += d * d;
        }
        return s;
    }

    private static double[][] copy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) out[i] = src[i].clone();
        return out;
    }
}
