package com.asad.player_profiler.service;

import com.asad.player_profiler.exception.DegenerateInputException;
import com.asad.player_profiler.model.PcaResult;
import com.asad.player_profiler.model.ScaledFeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Principal components of the scaled matrix, for plotting and variance reporting.
 * Components are ordered by eigenvalue and each one's sign is fixed so that its
 * largest loading is positive; the result is fully deterministic.
 */
@Slf4j
@Service
public class PcaService {

    public PcaResult analyze(List<ScaledFeatureVector> rows, int components) {
        List<String> ids = new ArrayList<>(rows.size());
        for (ScaledFeatureVector r : rows) ids.add(r.playerId());
        return analyze(ScalerService.scaledMatrix(rows), ids, components);
    }

    public PcaResult analyze(double[][] matrix, List<String> ids, int components) {
        int n = matrix.length;
        if (n < 2) {
            throw new DegenerateInputException("PCA needs at least 2 players, got " + n);
        }
        int width = matrix[0].length;
        int keep = Math.max(1, Math.min(components, width));

        RealMatrix cov = new Covariance(matrix).getCovarianceMatrix();
        EigenDecomposition eig = new EigenDecomposition(cov);
        double[] eigenvalues = eig.getRealEigenvalues();

        Integer[] order = new Integer[eigenvalues.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> {
            int cmp = Double.compare(eigenvalues[b], eigenvalues[a]);
            return cmp != 0 ? cmp : Integer.compare(a, b);
        });

        double total = 0.0;
        for (double v : eigenvalues) total += Math.max(0.0, v);

        double[] ratio = new double[width];
        double[] cumulative = new double[width];
        double running = 0.0;
        for (int i = 0; i < width; i++) {
            ratio[i] = total > 0 ? Math.max(0.0, eigenvalues[order[i]]) / total : 0.0;
            running += ratio[i];
            cumulative[i] = running;
        }

        double[][] loadings = new double[keep][];
        for (int c = 0; c < keep; c++) {
            loadings[c] = orient(eig.getEigenvector(order[c]).toArray());
        }

        double[] means = new double[width];
        for (double[] row : matrix) {
            for (int j = 0; j < width; j++) means[j] += row[j];
        }
        for (int j = 0; j < width; j++) means[j] /= n;

        List<PcaResult.Projection> projections = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double[] coords = new double[keep];
            for (int c = 0; c < keep; c++) {
                double s = 0.0;
                for (int j = 0; j < width; j++) s += (matrix[i][j] - means[j]) * loadings[c][j];
                coords[c] = s;
            }
            projections.add(new PcaResult.Projection(ids.get(i), coords));
        }

        log.info("PCA: first {} components explain {} of the variance; {} components reach 90%",
                keep, String.format(Locale.ROOT, "%.1f%%", 100 * cumulative[keep - 1]),
                componentsFor(cumulative, 0.9));
        return new PcaResult(ratio, cumulative, loadings, projections);
    }

    /** Flips the vector so its largest-magnitude entry is positive. */
    static double[] orient(double[] v) {
        int idx = 0;
        for (int j = 1; j < v.length; j++) {
            if (Math.abs(v[j]) > Math.abs(v[idx])) idx = j;
        }
        if (v[idx] < 0) {
            for (int j = 0; j < v.length; j++) v[j] = -v[j];
        }
        return v;
    }

    private static int componentsFor(double[] cumulative, double share) {
        for (int i = 0; i < cumulative.length; i++) {
            if (cumulative[i] >= share) return i + 1;
        }
        return cumulative.length;
    }
}
