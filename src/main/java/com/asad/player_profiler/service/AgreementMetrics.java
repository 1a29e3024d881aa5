package com.asad.player_profiler.service;

/**
 * Chance-corrected agreement between two labelings of the same points.
 */
public final class AgreementMetrics {

    private AgreementMetrics() {}

    /**
     * Adjusted Rand Index. 1 for identical partitions (whatever the label numbers),
     * around 0 for independent ones. Labels must be non-negative.
     */
    public static double adjustedRandIndex(int[] a, int[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("labelings differ in length: " + a.length + " vs " + b.length);
        }
        int n = a.length;
        if (n < 2) return 1.0;

        int rows = maxLabel(a) + 1;
        int cols = maxLabel(b) + 1;
        long[][] table = new long[rows][cols];
        long[] rowSums = new long[rows];
        long[] colSums = new long[cols];
        for (int i = 0; i < n; i++) {
            table[a[i]][b[i]]++;
            rowSums[a[i]]++;
            colSums[b[i]]++;
        }

        double index = 0.0;
        for (long[] row : table) {
            for (long cell : row) index += pairs(cell);
        }
        double sumRows = 0.0;
        for (long r : rowSums) sumRows += pairs(r);
        double sumCols = 0.0;
        for (long c : colSums) sumCols += pairs(c);

        double expected = sumRows * sumCols / pairs(n);
        double max = (sumRows + sumCols) / 2.0;
        if (max == expected) return 1.0;
        return (index - expected) / (max - expected);
    }

    private static double pairs(long m) {
        return m * (m - 1) / 2.0;
    }

    private static int maxLabel(int[] labels) {
        int max = 0;
        for (int label : labels) {
            if (label < 0) throw new IllegalArgumentException("negative label " + label);
            max = Math.max(max, label);
        }
        return max;
    }
}
