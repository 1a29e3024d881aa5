package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.DegenerateInputException;
import com.asad.player_profiler.model.ClusteringFeature;
import com.asad.player_profiler.model.FeatureVector;
import com.asad.player_profiler.model.ScaledFeatureVector;
import com.asad.player_profiler.model.ScalerParameters;
import com.asad.player_profiler.model.ScalerType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
public class ScalerService {

    // a column whose spread is below this is treated as constant
    private static final double CONSTANT_EPSILON = 1e-12;

    private final ScalerType type;

    public ScalerService(ProfilerProperties properties) {
        this.type = properties.getScaler().getType();
    }

    public ScalerParameters fit(List<FeatureVector> population) {
        return fit(toMatrix(population), Arrays.asList(ClusteringFeature.columns()));
    }

    /**
     * Fits on the whole matrix in one pass. Constant columns get scale 1, which makes them
     * constant zero after transform. Needs at least two non-constant columns.
     */
    public ScalerParameters fit(double[][] matrix, List<String> columns) {
        if (matrix.length == 0) {
            throw new DegenerateInputException("cannot fit scaler on an empty population");
        }
        int width = columns.size();
        double[] center = new double[width];
        double[] scale = new double[width];
        int informative = 0;

        StandardDeviation std = new StandardDeviation(false);
        for (int j = 0; j < width; j++) {
            double[] col = column(matrix, j);
            double spread;
            if (type == ScalerType.MIN_MAX) {
                center[j] = new Min().evaluate(col);
                spread = new Max().evaluate(col) - center[j];
            } else {
                center[j] = new Mean().evaluate(col);
                spread = std.evaluate(col, center[j]);
            }

            if (spread > CONSTANT_EPSILON) {
                scale[j] = spread;
                informative++;
            } else {
                scale[j] = 1.0;
                log.info("Column {} is constant; it will scale to 0", columns.get(j));
            }
        }

        if (informative < 2) {
            throw new DegenerateInputException("only " + informative
                    + " non-constant feature columns across " + matrix.length + " players; need at least 2");
        }

        log.info("Fitted {} scaler on {} players x {} columns ({} informative)",
                type, matrix.length, width, informative);
        return new ScalerParameters(type, columns, center, scale);
    }

    public List<ScaledFeatureVector> transform(ScalerParameters params, List<FeatureVector> population) {
        List<ScaledFeatureVector> out = new ArrayList<>(population.size());
        for (FeatureVector v : population) {
            out.add(new ScaledFeatureVector(v.playerId(), params.transform(v.clusteringValues())));
        }
        return out;
    }

    public double[][] transform(ScalerParameters params, double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) out[i] = params.transform(matrix[i]);
        return out;
    }

    public static double[][] toMatrix(List<FeatureVector> population) {
        double[][] m = new double[population.size()][];
        for (int i = 0; i < m.length; i++) m[i] = population.get(i).clusteringValues();
        return m;
    }

    public static double[][] scaledMatrix(List<ScaledFeatureVector> scaled) {
        double[][] m = new double[scaled.size()][];
        for (int i = 0; i < m.length; i++) m[i] = scaled.get(i).values();
        return m;
    }

    private static double[] column(double[][] m, int j) {
        double[] c = new double[m.length];
        for (int i = 0; i < m.length; i++) c[i] = m[i][j];
        return c;
    }
}
