package com.asad.player_profiler.model;

import java.util.Arrays;
import java.util.List;

/**
 * Fitted per-column affine map {@code (x - center) / scale}. Created once per pipeline run
 * and handed to whatever needs to transform new players against the same model.
 */
public record ScalerParameters(ScalerType type, List<String> columns, double[] center, double[] scale) {

    public ScalerParameters {
        if (center.length != scale.length || center.length != columns.size()) {
            throw new IllegalArgumentException("center, scale and columns must have the same length");
        }
        for (double s : scale) {
            if (s == 0.0 || Double.isNaN(s)) {
                throw new IllegalArgumentException("scale must be non-zero; use 1 for constant columns");
            }
        }
        columns = List.copyOf(columns);
        center = center.clone();
        scale = scale.clone();
    }

    @Override
    public double[] center() {
        return center.clone();
    }

    @Override
    public double[] scale() {
        return scale.clone();
    }

    public int width() {
        return center.length;
    }

    public double[] transform(double[] row) {
        checkWidth(row);
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - center[j]) / scale[j];
        }
        return out;
    }

    public double[] inverseTransform(double[] scaled) {
        checkWidth(scaled);
        double[] out = new double[scaled.length];
        for (int j = 0; j < scaled.length; j++) {
            out[j] = scaled[j] * scale[j] + center[j];
        }
        return out;
    }

    private void checkWidth(double[] row) {
        if (row.length != center.length) {
            throw new IllegalArgumentException("expected " + center.length + " columns, got " + row.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalerParameters other)) return false;
        return type == other.type && columns.equals(other.columns)
                && Arrays.equals(center, other.center) && Arrays.equals(scale, other.scale);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * columns.hashCode() + Arrays.hashCode(center)) + Arrays.hashCode(scale);
    }

    @Override
    public String toString() {
        return "ScalerParameters[" + type + ", center=" + Arrays.toString(center) + ", scale=" + Arrays.toString(scale) + "]";
    }
}
